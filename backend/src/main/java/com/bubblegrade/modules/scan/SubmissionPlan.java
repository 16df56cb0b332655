package com.bubblegrade.modules.scan;

import java.util.List;
import java.util.Optional;

/**
 * What to do with the existing active scans of an (exam, student) pair before
 * accepting a new sheet.
 *
 * @param toOutdate scans to retire as superseded
 * @param reuse     scan to reset in place for a redo; empty means create a new scan
 */
public record SubmissionPlan(List<Scan> toOutdate, Optional<Scan> reuse) {

    public SubmissionPlan {
        toOutdate = List.copyOf(toOutdate);
    }

    public static SubmissionPlan fresh(List<Scan> toOutdate) {
        return new SubmissionPlan(toOutdate, Optional.empty());
    }

    public boolean isRedo() {
        return reuse.isPresent();
    }
}
