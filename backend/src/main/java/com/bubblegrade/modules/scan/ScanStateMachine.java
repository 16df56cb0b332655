package com.bubblegrade.modules.scan;

import com.bubblegrade.exception.InvalidScanTransitionException;
import com.bubblegrade.modules.grading.GradingResult;
import com.bubblegrade.modules.grading.ScoreSummary;
import com.bubblegrade.modules.scan.detection.DetectionIssue;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.bubblegrade.modules.scan.detection.DetectionResultStatus;
import com.bubblegrade.modules.scan.detection.DetectionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * The only code that changes a scan's status. Each operation checks the
 * transition, returns a new snapshot and appends to the audit log.
 *
 * <pre>
 * queued | processing → detected | needs_review | failed
 * detected | needs_review → graded | needs_review → reviewed
 * any active status → outdated (one-way), queued (redo)
 * queued | processing → error
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class ScanStateMachine {

    private static final Set<ScanStatus> GRADABLE = EnumSet.of(ScanStatus.DETECTED, ScanStatus.NEEDS_REVIEW);
    private static final Set<ScanStatus> REVIEWABLE = EnumSet.of(ScanStatus.DETECTED, ScanStatus.GRADED,
            ScanStatus.NEEDS_REVIEW, ScanStatus.REVIEWED);

    private final Clock clock;

    public Scan create(String scanId, UUID examId, UUID studentId, UUID classId, String templateId,
            String imagePath) {
        Instant now = clock.instant();
        Scan scan = Scan.builder()
                .scanId(scanId)
                .examId(examId)
                .studentId(studentId)
                .classId(classId)
                .templateId(templateId)
                .imagePath(imagePath)
                .status(ScanStatus.QUEUED)
                .processingStartedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return scan.append(AuditEntry.info(now, "Scan queued for detection",
                data("image_path", imagePath, "template_id", templateId)));
    }

    /** Stores the vision worker's facts and derives the post-detection status. */
    public Scan applyDetection(Scan scan, DetectionResult result) {
        ScanStatus next = switch (result.status()) {
            case SUCCESS -> ScanStatus.DETECTED;
            case NEEDS_REVIEW -> ScanStatus.NEEDS_REVIEW;
            case FAILED -> ScanStatus.FAILED;
        };
        require(scan, next, scan.status().isAwaitingDetection());

        Instant now = clock.instant();
        Scan.ScanBuilder builder = scan.toBuilder()
                .status(next)
                .detection(result)
                .grading(null)
                .processingTimeMs(result.processingTimeMs())
                .processingCompletedAt(now)
                .updatedAt(now);

        if (next == ScanStatus.FAILED) {
            DetectionIssue first = result.firstError().orElse(null);
            builder.errorCode(first != null ? first.code() : null)
                    .errorMessage(first != null ? first.message() : null);
            return builder.build().append(AuditEntry.error(now, "Detection failed",
                    data("error_code", first != null ? first.code() : null,
                            "error_message", first != null ? first.message() : null)));
        }

        return builder.errorCode(null).errorMessage(null).build()
                .append(AuditEntry.info(now, "Detection completed",
                        data("status", next.getValue(),
                                "detections", result.detections().size(),
                                "warnings", result.warnings().size())));
    }

    public Scan applyGrading(Scan scan, GradingResult grading, String gradedBy) {
        ScanStatus next = grading.needsManualReview() ? ScanStatus.NEEDS_REVIEW : ScanStatus.GRADED;
        require(scan, next, GRADABLE.contains(scan.status()));
        Instant now = clock.instant();
        return scan.toBuilder()
                .status(next)
                .grading(grading)
                .gradedAt(now)
                .gradedBy(gradedBy)
                .updatedAt(now)
                .build()
                .append(AuditEntry.info(now, "Graded", scoreData(grading)));
    }

    /** Keeps the detection facts; status stays as detection left it. */
    public Scan recordGradingFailure(Scan scan, String reason) {
        Instant now = clock.instant();
        return scan.toBuilder()
                .updatedAt(now)
                .build()
                .append(AuditEntry.warn(now, "Grading failed", data("reason", reason)));
    }

    /**
     * Replaces detection facts with a reviewer's edit. With a grading result the
     * status follows it; without one (no exam linked, or grading failed) the
     * status reflects the detection facts alone, and {@code gradingFailure}
     * is recorded on the edit's audit entry.
     */
    public Scan applyManualEdit(Scan scan, DetectionResult edited, List<Integer> changedQuestions, String editor,
            GradingResult grading, String gradingFailure) {
        if (scan.status() == ScanStatus.OUTDATED) {
            throw new InvalidScanTransitionException(scan.scanId(), scan.status(), "edited");
        }
        if (!scan.hasDetection()) {
            throw new InvalidScanTransitionException(scan.scanId(), scan.status(), "edited before detection");
        }

        Instant now = clock.instant();
        Scan.ScanBuilder builder = scan.toBuilder()
                .detection(edited)
                .updatedAt(now);

        Map<String, Object> data = data("edited_by", editor, "questions", List.copyOf(changedQuestions));
        if (grading != null) {
            builder.status(grading.needsManualReview() ? ScanStatus.NEEDS_REVIEW : ScanStatus.GRADED)
                    .grading(grading)
                    .gradedAt(now)
                    .gradedBy(editor);
            data.putAll(scoreData(grading));
        } else {
            // the previous score no longer matches the answers
            builder.status(statusFromDetection(edited))
                    .grading(null)
                    .gradedAt(null)
                    .gradedBy(null);
        }
        if (gradingFailure != null) {
            data.put("grading_error", gradingFailure);
            return builder.build().append(AuditEntry.warn(now, "Answers edited", data));
        }
        return builder.build().append(AuditEntry.info(now, "Answers edited", data));
    }

    public Scan markReviewed(Scan scan, String reviewer, String notes) {
        require(scan, ScanStatus.REVIEWED, REVIEWABLE.contains(scan.status()));
        Instant now = clock.instant();
        return scan.toBuilder()
                .status(ScanStatus.REVIEWED)
                .reviewedBy(reviewer)
                .reviewedAt(now)
                .reviewNotes(notes)
                .updatedAt(now)
                .build()
                .append(AuditEntry.info(now, "Marked as reviewed", data("reviewed_by", reviewer, "notes", notes)));
    }

    /** Retires a scan superseded by a newer submission for the same exam and student. */
    public Scan markOutdated(Scan scan, String supersededBy) {
        require(scan, ScanStatus.OUTDATED, !scan.status().isRetired());
        Instant now = clock.instant();
        return scan.toBuilder()
                .status(ScanStatus.OUTDATED)
                .updatedAt(now)
                .build()
                .append(AuditEntry.info(now, "Superseded by newer submission",
                        data("superseded_by", supersededBy, "previous_status", scan.status().getValue())));
    }

    /**
     * Reuses an active scan for a re-scanned sheet: new image, empty facts,
     * back to queued. The discarded image and score stay in the audit log.
     */
    public Scan resetForRedo(Scan scan, String newImagePath) {
        require(scan, ScanStatus.QUEUED, !scan.status().isRetired());
        Instant now = clock.instant();
        ScoreSummary previousScore = scan.grading() != null ? scan.grading().score() : null;
        return scan.toBuilder()
                .status(ScanStatus.QUEUED)
                .imagePath(newImagePath)
                .detection(null)
                .grading(null)
                .errorCode(null)
                .errorMessage(null)
                .processingStartedAt(now)
                .processingCompletedAt(null)
                .processingTimeMs(null)
                .gradedAt(null)
                .gradedBy(null)
                .reviewedBy(null)
                .reviewedAt(null)
                .reviewNotes(null)
                .updatedAt(now)
                .build()
                .append(AuditEntry.info(now, "Redo requested; previous submission discarded",
                        data("discarded_image_path", scan.imagePath(),
                                "previous_status", scan.status().getValue(),
                                "previous_points_earned", previousScore != null ? previousScore.pointsEarned() : null,
                                "image_path", newImagePath)));
    }

    /** Unusable worker output for a scan still awaiting detection. */
    public Scan markError(Scan scan, String code, String message) {
        require(scan, ScanStatus.ERROR, scan.status().isAwaitingDetection());
        Instant now = clock.instant();
        return scan.toBuilder()
                .status(ScanStatus.ERROR)
                .errorCode(code)
                .errorMessage(message)
                .processingCompletedAt(now)
                .updatedAt(now)
                .build()
                .append(AuditEntry.error(now, "Ingestion failed", data("error_code", code, "error_message", message)));
    }

    static ScanStatus statusFromDetection(DetectionResult detection) {
        boolean ambiguous = detection.detections().stream()
                .anyMatch(d -> d.detectionStatus() == DetectionStatus.AMBIGUOUS);
        return ambiguous || detection.status() == DetectionResultStatus.NEEDS_REVIEW
                ? ScanStatus.NEEDS_REVIEW
                : ScanStatus.DETECTED;
    }

    private static void require(Scan scan, ScanStatus target, boolean allowed) {
        if (!allowed) {
            throw new InvalidScanTransitionException(scan.scanId(), scan.status(), target);
        }
    }

    private static Map<String, Object> scoreData(GradingResult grading) {
        ScoreSummary score = grading.score();
        return data("points_earned", score.pointsEarned(),
                "points_possible", score.pointsPossible(),
                "percentage", score.percentage(),
                "needs_manual_review", grading.needsManualReview());
    }

    private static Map<String, Object> data(Object... pairs) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
