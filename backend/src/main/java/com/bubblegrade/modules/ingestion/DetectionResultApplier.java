package com.bubblegrade.modules.ingestion;

import com.bubblegrade.modules.scan.Scan;
import com.bubblegrade.modules.scan.ScanGrader;
import com.bubblegrade.modules.scan.ScanStateMachine;
import com.bubblegrade.modules.scan.ScanStatus;
import com.bubblegrade.modules.scan.ScanStore;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.bubblegrade.modules.scan.detection.DetectionResultStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Applies one detection result to its scan: store the facts, derive the
 * status, grade when an exam is linked. The whole update is one write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectionResultApplier {

    static final String GRADED_BY_SYSTEM = "system";

    private final ScanStore scanStore;
    private final ScanStateMachine stateMachine;
    private final ScanGrader scanGrader;

    @Transactional
    public IngestionOutcome apply(DetectionResult result) {
        Optional<Scan> found = scanStore.load(result.scanId());
        if (found.isEmpty()) {
            log.warn("Detection result for unknown scan {}, dropping", result.scanId());
            return IngestionOutcome.UNKNOWN_SCAN;
        }

        Scan scan = found.get();
        if (scan.status() == ScanStatus.OUTDATED) {
            log.info("Detection result for outdated scan {}, ignoring", scan.scanId());
            return IngestionOutcome.OUTDATED_SCAN;
        }
        if (!scan.status().isAwaitingDetection()) {
            log.warn("Scan {} is already {}, dropping repeated detection result", scan.scanId(),
                    scan.status().getValue());
            return IngestionOutcome.DUPLICATE;
        }

        if (result.templateId() != null && !Objects.equals(result.templateId(), scan.templateId())) {
            scanStore.save(stateMachine.markError(scan, "TEMPLATE_MISMATCH",
                    "Result template " + result.templateId() + " does not match scan template " + scan.templateId()));
            log.warn("Scan {} moved to error: template mismatch ({} vs {})", scan.scanId(), result.templateId(),
                    scan.templateId());
            return IngestionOutcome.REJECTED;
        }
        if (result.status() == DetectionResultStatus.SUCCESS && result.detections().isEmpty()) {
            scanStore.save(stateMachine.markError(scan, "NO_DETECTIONS",
                    "Worker reported success without any detections"));
            log.warn("Scan {} moved to error: success without detections", scan.scanId());
            return IngestionOutcome.REJECTED;
        }

        Scan updated = stateMachine.applyDetection(scan, result);
        if (updated.isLinkedToExam()
                && (updated.status() == ScanStatus.DETECTED || updated.status() == ScanStatus.NEEDS_REVIEW)) {
            ScanGrader.Attempt attempt = scanGrader.grade(updated, result);
            updated = attempt.succeeded()
                    ? stateMachine.applyGrading(updated, attempt.result(), GRADED_BY_SYSTEM)
                    : stateMachine.recordGradingFailure(updated, attempt.failure());
        }

        Scan saved = scanStore.save(updated);
        log.info("Applied detection result to scan {} (status={}, detections={})", saved.scanId(),
                saved.status().getValue(), result.detections().size());
        return IngestionOutcome.APPLIED;
    }
}
