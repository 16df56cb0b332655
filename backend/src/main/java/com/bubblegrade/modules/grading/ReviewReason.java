package com.bubblegrade.modules.grading;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReviewReason {
    AMBIGUOUS("ambiguous"),
    UNANSWERED("unanswered"),
    LOW_CONFIDENCE("low_confidence"),
    MULTIPLE_MARKS("multiple_marks");

    @JsonValue
    private final String value;
}
