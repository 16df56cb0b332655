package com.bubblegrade.support;

import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.grading.GradingPolicy;
import com.bubblegrade.modules.grading.KeyedAnswer;
import com.bubblegrade.modules.scan.detection.DetectionIssue;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.bubblegrade.modules.scan.detection.DetectionResultStatus;
import com.bubblegrade.modules.scan.detection.DetectionStatus;
import com.bubblegrade.modules.scan.detection.QuestionDetection;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class Fixtures {

    public static final String TEMPLATE = "tpl-20q";

    private Fixtures() {
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }

    /** Two one-point questions: Q1 = A, Q2 = B; no penalty; ambiguity forces review. */
    public static AnswerKey twoQuestionKey(UUID examId) {
        return new AnswerKey(examId, TEMPLATE,
                List.of(new KeyedAnswer(1, "A", 1.0), new KeyedAnswer(2, "B", 1.0)),
                new GradingPolicy(false, 0.0, true));
    }

    public static QuestionDetection answered(int questionId, String... selected) {
        return new QuestionDetection(questionId, Map.of(), Arrays.asList(selected), DetectionStatus.ANSWERED, 0.95,
                false);
    }

    public static QuestionDetection unanswered(int questionId) {
        return new QuestionDetection(questionId, Map.of(), List.of(), DetectionStatus.UNANSWERED, 0.9, false);
    }

    public static QuestionDetection ambiguous(int questionId, String... selected) {
        return new QuestionDetection(questionId, Map.of("A", 0.45, "B", 0.41), Arrays.asList(selected),
                DetectionStatus.AMBIGUOUS, 0.4, false);
    }

    public static DetectionResult success(String scanId, QuestionDetection... detections) {
        return result(scanId, DetectionResultStatus.SUCCESS, detections);
    }

    public static DetectionResult result(String scanId, DetectionResultStatus status,
            QuestionDetection... detections) {
        return new DetectionResult(scanId, TEMPLATE, status, List.of(detections), null, List.of(), List.of(), 850L,
                "2026-03-02T08:00:00Z");
    }

    public static DetectionResult failure(String scanId, String code, String message) {
        return new DetectionResult(scanId, TEMPLATE, DetectionResultStatus.FAILED, List.of(), null, List.of(),
                List.of(new DetectionIssue(code, message, null, "paper_detection")), 300L, null);
    }
}
