package com.bubblegrade.modules.grading;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoreSummary(
        @JsonProperty("points_earned") double pointsEarned,
        @JsonProperty("points_possible") double pointsPossible,
        @JsonProperty("percentage") double percentage,
        @JsonProperty("correct_count") int correctCount,
        @JsonProperty("incorrect_count") int incorrectCount,
        @JsonProperty("unanswered_count") int unansweredCount,
        @JsonProperty("ambiguous_count") int ambiguousCount) {

    public int questionCount() {
        return correctCount + incorrectCount + unansweredCount + ambiguousCount;
    }
}
