package com.bubblegrade.modules.grading;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of {@link GradingEngine}. Holds no timestamps so that grading the same
 * inputs twice yields equal results; the scan records when it was graded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GradingResult(
        @JsonProperty("scan_id") String scanId,
        @JsonProperty("exam_id") String examId,
        @JsonProperty("status") GradingStatus status,
        @JsonProperty("grades") List<QuestionGrade> grades,
        @JsonProperty("score") ScoreSummary score,
        @JsonProperty("needs_manual_review") boolean needsManualReview) {

    public GradingResult {
        grades = grades == null ? List.of() : List.copyOf(grades);
    }
}
