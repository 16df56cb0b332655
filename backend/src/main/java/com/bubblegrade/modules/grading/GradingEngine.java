package com.bubblegrade.modules.grading;

import com.bubblegrade.exception.GradingException;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.bubblegrade.modules.scan.detection.DetectionResultStatus;
import com.bubblegrade.modules.scan.detection.DetectionStatus;
import com.bubblegrade.modules.scan.detection.QuestionDetection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns detection facts and an answer key into scores. Pure: no clock, no I/O,
 * no shared state. The ingestion path and the manual-edit regrade call the same
 * method.
 */
@Component
public class GradingEngine {

    public GradingResult grade(String scanId, UUID examId, DetectionResult detection, AnswerKey key) {
        return grade(scanId, examId, detection, key, key.policy());
    }

    public GradingResult grade(String scanId, UUID examId, DetectionResult detection, AnswerKey key,
            GradingPolicy policy) {
        if (detection == null) {
            throw new GradingException("Scan " + scanId + " has no detection facts to grade");
        }
        if (key == null || key.isEmpty()) {
            throw new GradingException("Exam " + examId + " has no answer key");
        }
        GradingPolicy effectivePolicy = policy == null ? GradingPolicy.DEFAULT : policy;
        Map<Integer, KeyedAnswer> keyed = key.byQuestion();

        double runningTotal = 0;
        double pointsPossible = 0;
        int correct = 0;
        int incorrect = 0;
        int unanswered = 0;
        int ambiguous = 0;
        List<QuestionGrade> grades = new ArrayList<>();
        Set<Integer> graded = new HashSet<>();

        for (QuestionDetection d : detection.detections()) {
            KeyedAnswer answer = keyed.get(d.questionId());
            // unkeyed questions and repeated detections for a graded question are ignored
            if (answer == null || !graded.add(d.questionId())) {
                continue;
            }

            double questionPoints = answer.pointValue();
            pointsPossible += questionPoints;

            Boolean isCorrect;
            double earned = 0;
            boolean requiresReview = false;
            ReviewReason reason = null;

            if (d.detectionStatus() == DetectionStatus.AMBIGUOUS) {
                isCorrect = null;
                requiresReview = true;
                reason = ReviewReason.AMBIGUOUS;
                ambiguous++;
            } else if (d.selected().isEmpty()) {
                isCorrect = false;
                unanswered++;
            } else {
                isCorrect = d.selected().size() == 1 && matches(d.selected().get(0), answer.correct());
                if (isCorrect) {
                    earned = questionPoints;
                    correct++;
                } else {
                    incorrect++;
                    if (effectivePolicy.penaltyIncorrect() > 0) {
                        earned = -effectivePolicy.penaltyIncorrect();
                    }
                }
            }

            runningTotal += earned;
            grades.add(new QuestionGrade(d.questionId(), d.selected(), answer.correct(), isCorrect, earned,
                    questionPoints, requiresReview, reason));
        }

        double pointsEarned = Math.max(0, runningTotal);
        double percentage = pointsPossible > 0 ? (pointsEarned / pointsPossible) * 100 : 0;
        boolean needsReview = (effectivePolicy.requireManualReviewOnAmbiguity() && ambiguous > 0)
                || detection.status() == DetectionResultStatus.NEEDS_REVIEW;

        ScoreSummary score = new ScoreSummary(pointsEarned, pointsPossible, percentage, correct, incorrect,
                unanswered, ambiguous);
        return new GradingResult(scanId, examId == null ? null : examId.toString(),
                needsReview ? GradingStatus.NEEDS_REVIEW : GradingStatus.GRADED, grades, score, needsReview);
    }

    private static boolean matches(String selected, String correct) {
        if (selected == null || correct == null) {
            return false;
        }
        return selected.trim().toUpperCase(Locale.ROOT).equals(correct.trim().toUpperCase(Locale.ROOT));
    }
}
