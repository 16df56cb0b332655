package com.bubblegrade.modules.grading;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum GradingStatus {
    GRADED("graded"),
    NEEDS_REVIEW("needs_review");

    @JsonValue
    private final String value;
}
