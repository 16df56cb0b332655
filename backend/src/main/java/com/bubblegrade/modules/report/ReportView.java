package com.bubblegrade.modules.report;

import com.bubblegrade.exception.BusinessException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReportView {
    SECTION, OVERALL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses the {@code view} query parameter; absent means per-section. */
    public static ReportView fromParam(String value) {
        if (value == null || value.isBlank()) {
            return SECTION;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "section" -> SECTION;
            case "overall" -> OVERALL;
            default -> throw new BusinessException("Invalid view parameter. Must be 'section' or 'overall'");
        };
    }
}
