package com.bubblegrade.modules.scan;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for scan snapshots. A {@link #save} writes exactly one
 * record.
 */
public interface ScanStore {

    Optional<Scan> load(String scanId);

    /**
     * Persists the snapshot and returns it as stored (with its new version).
     *
     * @throws com.bubblegrade.exception.ConcurrentSubmissionException when the
     *         write would leave two active scans for the same exam and student
     */
    Scan save(Scan scan);

    List<Scan> find(ScanQuery query);
}
