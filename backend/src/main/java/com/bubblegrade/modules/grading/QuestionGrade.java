package com.bubblegrade.modules.grading;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Grading decision for one keyed question.
 *
 * @param isCorrect {@code null} when correctness is unknown (ambiguous mark)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionGrade(
        @JsonProperty("question_id") int questionId,
        @JsonProperty("detected") List<String> detected,
        @JsonProperty("correct_answer") String correctAnswer,
        @JsonProperty("is_correct") Boolean isCorrect,
        @JsonProperty("points_earned") double pointsEarned,
        @JsonProperty("points_possible") double pointsPossible,
        @JsonProperty("requires_review") boolean requiresReview,
        @JsonProperty("review_reason") ReviewReason reviewReason) {
}
