package com.bubblegrade.modules.scan.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DetectionResultStatus {
    SUCCESS("success"),
    FAILED("failed"),
    NEEDS_REVIEW("needs_review");

    @JsonValue
    private final String value;

    @JsonCreator
    public static DetectionResultStatus fromValue(String value) {
        for (DetectionResultStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown detection result status: " + value);
    }
}
