package com.bubblegrade.modules.scan.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * What the vision worker saw for one question: fill ratio per option, the
 * option(s) it considers marked, and how sure it is.
 *
 * @param manuallyEdited set once a reviewer changed {@code selected} by hand
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionDetection(
        @JsonProperty("question_id") int questionId,
        @JsonProperty("fill_ratios") Map<String, Double> fillRatios,
        @JsonProperty("selected") List<String> selected,
        @JsonProperty("detection_status") DetectionStatus detectionStatus,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("manually_edited") boolean manuallyEdited) {

    public QuestionDetection {
        fillRatios = fillRatios == null ? Map.of() : Map.copyOf(fillRatios);
        selected = selected == null ? List.of() : List.copyOf(selected);
        if (detectionStatus == null) {
            detectionStatus = selected.isEmpty() ? DetectionStatus.UNANSWERED : DetectionStatus.ANSWERED;
        }
    }

    public static QuestionDetection manual(int questionId, List<String> selected) {
        return new QuestionDetection(questionId, Map.of(), selected, statusFor(selected), null, true);
    }

    /** Replaces the marked options with a reviewer's choice. */
    public QuestionDetection withManualSelection(List<String> newSelection) {
        return new QuestionDetection(questionId, fillRatios, newSelection, statusFor(newSelection), confidence, true);
    }

    /** Same marked options regardless of order, case or repeats. */
    public boolean hasSameSelection(List<String> other) {
        return new HashSet<>(normalize(selected)).equals(new HashSet<>(normalize(other)));
    }

    /** Trimmed, uppercased options without blanks or repeats, in first-seen order. */
    public static List<String> normalize(List<String> selection) {
        if (selection == null) {
            return List.of();
        }
        return selection.stream()
                .filter(Objects::nonNull)
                .map(option -> option.trim().toUpperCase(Locale.ROOT))
                .filter(option -> !option.isEmpty())
                .distinct()
                .toList();
    }

    private static DetectionStatus statusFor(List<String> selection) {
        return selection == null || selection.isEmpty() ? DetectionStatus.UNANSWERED : DetectionStatus.ANSWERED;
    }
}
