package com.bubblegrade.modules.scan.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Per-question outcome reported by the vision worker. Carries no correctness judgment. */
@Getter
@RequiredArgsConstructor
public enum DetectionStatus {
    ANSWERED("answered"),
    UNANSWERED("unanswered"),
    AMBIGUOUS("ambiguous"),
    ERROR("error");

    @JsonValue
    private final String value;

    @JsonCreator
    public static DetectionStatus fromValue(String value) {
        for (DetectionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown detection status: " + value);
    }
}
