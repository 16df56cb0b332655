package com.bubblegrade.modules.scan.dto;

import com.bubblegrade.modules.grading.GradingResult;
import com.bubblegrade.modules.scan.AuditEntry;
import com.bubblegrade.modules.scan.ScanStatus;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class ScanDto {
    private String scanId;
    private UUID examId;
    private UUID studentId;
    private UUID classId;
    private String templateId;
    private String imagePath;
    private ScanStatus status;
    /** True once a client polling for completion can stop */
    private boolean terminal;
    /** True when an existing scan was reused for a redo upload */
    private boolean redo;
    private DetectionResult detection;
    private GradingResult grading;
    private String errorCode;
    private String errorMessage;
    private Instant processingStartedAt;
    private Instant processingCompletedAt;
    private Long processingTimeMs;
    private Instant gradedAt;
    private String gradedBy;
    private String reviewedBy;
    private Instant reviewedAt;
    private String reviewNotes;
    private Instant createdAt;
    private Instant updatedAt;
    private List<AuditEntry> auditLog;
}
