package com.bubblegrade.modules.scan;

import com.bubblegrade.modules.grading.GradingResult;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot of one submitted answer sheet. Every change goes through
 * {@link ScanStateMachine}, which returns a new snapshot; {@link ScanStore}
 * persists it as a single write.
 *
 * <p>{@code examId} and {@code studentId} are null for answer-key sheets, which
 * are detected but never graded.
 */
@Builder(toBuilder = true)
public record Scan(
        String scanId,
        UUID examId,
        UUID studentId,
        UUID classId,
        String templateId,
        String imagePath,
        ScanStatus status,
        DetectionResult detection,
        GradingResult grading,
        String errorCode,
        String errorMessage,
        Instant processingStartedAt,
        Instant processingCompletedAt,
        Long processingTimeMs,
        Instant gradedAt,
        String gradedBy,
        String reviewedBy,
        Instant reviewedAt,
        String reviewNotes,
        Instant createdAt,
        Instant updatedAt,
        List<AuditEntry> auditLog,
        Long version) {

    public Scan {
        auditLog = auditLog == null ? List.of() : List.copyOf(auditLog);
    }

    /** Returns a copy with {@code entry} added after the existing entries. */
    public Scan append(AuditEntry entry) {
        List<AuditEntry> entries = new ArrayList<>(auditLog.size() + 1);
        entries.addAll(auditLog);
        entries.add(entry);
        return toBuilder().auditLog(entries).build();
    }

    public boolean hasDetection() {
        return detection != null;
    }

    public boolean isLinkedToExam() {
        return examId != null;
    }
}
