package com.bubblegrade.modules.scan;

import com.bubblegrade.exception.GradingException;
import com.bubblegrade.modules.exam.AnswerKeyStore;
import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.grading.GradingEngine;
import com.bubblegrade.modules.grading.GradingResult;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Grades a scan's detection facts against its exam's key. Failures are
 * returned, not thrown, so the caller can still save the detection facts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanGrader {

    private final AnswerKeyStore answerKeyStore;
    private final GradingEngine gradingEngine;

    public Attempt grade(Scan scan, DetectionResult detection) {
        AnswerKey key = answerKeyStore.findByExamId(scan.examId()).orElse(null);
        if (key == null) {
            log.warn("No answer key for exam {}; scan {} left ungraded", scan.examId(), scan.scanId());
            return Attempt.failed("Answer key not found for exam " + scan.examId());
        }
        try {
            return Attempt.graded(gradingEngine.grade(scan.scanId(), scan.examId(), detection, key));
        } catch (GradingException e) {
            log.warn("Grading failed for scan {}: {}", scan.scanId(), e.getMessage());
            return Attempt.failed(e.getMessage());
        }
    }

    /** Either a result or the reason there is none. */
    public record Attempt(GradingResult result, String failure) {

        static Attempt graded(GradingResult result) {
            return new Attempt(result, null);
        }

        static Attempt failed(String reason) {
            return new Attempt(null, reason);
        }

        public boolean succeeded() {
            return result != null;
        }
    }
}
