package com.bubblegrade.modules.ingestion;

/**
 * What happened to one result message.
 */
public enum IngestionOutcome {
    /** Detection facts stored, and graded when the scan belongs to an exam */
    APPLIED(false),
    /** Usable message for a known scan, but the output was unusable; scan moved to error */
    REJECTED(false),
    /** No scan with that id */
    UNKNOWN_SCAN(true),
    /** Scan was superseded; outdated is one-way */
    OUTDATED_SCAN(true),
    /** Scan already has detection facts; repeated delivery */
    DUPLICATE(true),
    /** Could not be parsed */
    MALFORMED(true);

    private final boolean dropped;

    IngestionOutcome(boolean dropped) {
        this.dropped = dropped;
    }

    public boolean isDropped() {
        return dropped;
    }
}
