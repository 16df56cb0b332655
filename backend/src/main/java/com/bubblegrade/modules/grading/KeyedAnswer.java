package com.bubblegrade.modules.grading;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of an answer key.
 *
 * @param points point value; absent means 1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyedAnswer(
        @JsonProperty("question_id") int questionId,
        @JsonProperty("correct") String correct,
        @JsonProperty("points") Double points) {

    @JsonIgnore
    public double pointValue() {
        return points == null ? 1.0 : points;
    }
}
