package com.bubblegrade.modules.grading;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of an exam's correct answers and grading policy.
 */
public record AnswerKey(UUID examId, String templateId, List<KeyedAnswer> answers, GradingPolicy policy) {

    public AnswerKey {
        answers = answers == null ? List.of() : List.copyOf(answers);
        policy = policy == null ? GradingPolicy.DEFAULT : policy;
    }

    public double totalPoints() {
        return answers.stream().mapToDouble(KeyedAnswer::pointValue).sum();
    }

    public boolean isEmpty() {
        return answers.isEmpty();
    }

    /** Keyed questions in key order, first entry wins on duplicate ids. */
    public Map<Integer, KeyedAnswer> byQuestion() {
        Map<Integer, KeyedAnswer> map = new LinkedHashMap<>();
        for (KeyedAnswer answer : answers) {
            map.putIfAbsent(answer.questionId(), answer);
        }
        return map;
    }
}
