package com.bubblegrade.modules.scan;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum ScanStatus {
    UPLOADED("uploaded"),
    QUEUED("queued"),
    PROCESSING("processing"),
    DETECTED("detected"),
    GRADED("graded"),
    NEEDS_REVIEW("needs_review"),
    REVIEWED("reviewed"),
    OUTDATED("outdated"),
    FAILED("failed"),
    ERROR("error");

    /** Statuses that no longer count as the active submission for an (exam, student) pair. */
    public static final Set<ScanStatus> RETIRED = EnumSet.of(OUTDATED, FAILED, ERROR);

    /** Statuses a client polling for completion stops at. */
    public static final Set<ScanStatus> POLLING_TERMINAL = EnumSet.of(DETECTED, GRADED, NEEDS_REVIEW, REVIEWED,
            FAILED, ERROR);

    /** Statuses whose score feeds reports. */
    public static final Set<ScanStatus> SCORED = EnumSet.of(GRADED, REVIEWED);

    @JsonValue
    private final String value;

    public boolean isRetired() {
        return RETIRED.contains(this);
    }

    public boolean isTerminalForPolling() {
        return POLLING_TERMINAL.contains(this);
    }

    public boolean isAwaitingDetection() {
        return this == UPLOADED || this == QUEUED || this == PROCESSING;
    }
}
