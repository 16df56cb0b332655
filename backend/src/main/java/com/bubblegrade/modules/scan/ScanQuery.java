package com.bubblegrade.modules.scan;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Typed filters understood by {@link ScanStore#find(ScanQuery)}. Results are
 * always ordered by creation time, newest first.
 */
public sealed interface ScanQuery {

    /** Scans of one student for one exam, optionally leaving out retired ones. */
    record ByExamAndStudent(UUID examId, UUID studentId, boolean activeOnly) implements ScanQuery {
    }

    /** Scans of an exam restricted to a set of students and statuses; used for section reports. */
    record ByExamForStudents(UUID examId, Collection<UUID> studentIds, Set<ScanStatus> statuses)
            implements ScanQuery {

        public ByExamForStudents {
            studentIds = List.copyOf(studentIds);
            statuses = Set.copyOf(statuses);
        }
    }

    /** All scans of an exam, with or without outdated ones. */
    record ByExam(UUID examId, boolean includeOutdated) implements ScanQuery {
    }
}
