package com.bubblegrade.modules.scan;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AuditLevel {
    INFO("info"),
    WARN("warn"),
    ERROR("error");

    @JsonValue
    private final String value;
}
