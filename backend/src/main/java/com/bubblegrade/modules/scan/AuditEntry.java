package com.bubblegrade.modules.scan;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AuditEntry(Instant timestamp, AuditLevel level, String message, Map<String, Object> data) {

    public AuditEntry {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static AuditEntry info(Instant at, String message) {
        return new AuditEntry(at, AuditLevel.INFO, message, null);
    }

    public static AuditEntry info(Instant at, String message, Map<String, Object> data) {
        return new AuditEntry(at, AuditLevel.INFO, message, data);
    }

    public static AuditEntry warn(Instant at, String message, Map<String, Object> data) {
        return new AuditEntry(at, AuditLevel.WARN, message, data);
    }

    public static AuditEntry error(Instant at, String message, Map<String, Object> data) {
        return new AuditEntry(at, AuditLevel.ERROR, message, data);
    }
}
