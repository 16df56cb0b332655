package com.bubblegrade.modules.scan;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Keeps at most one active scan per (exam, student).
 *
 * <p>Without redo every active scan is superseded and a new one is created.
 * With redo the newest active scan is reused under its own id and only the
 * others are superseded. A redo with nothing to reuse behaves like a fresh
 * upload.
 */
@Component
public class DuplicateScanResolver {

    private static final Comparator<Scan> NEWEST_FIRST = Comparator
            .comparing(Scan::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));

    public SubmissionPlan plan(List<Scan> existing, boolean redo) {
        List<Scan> active = existing.stream()
                .filter(scan -> !scan.status().isRetired())
                .sorted(NEWEST_FIRST)
                .toList();

        if (active.isEmpty() || !redo) {
            return SubmissionPlan.fresh(active);
        }
        return new SubmissionPlan(active.subList(1, active.size()), Optional.of(active.get(0)));
    }
}
