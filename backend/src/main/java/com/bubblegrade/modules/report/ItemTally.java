package com.bubblegrade.modules.report;

import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.grading.KeyedAnswer;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.bubblegrade.modules.scan.detection.QuestionDetection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-question correct counts over a population of students, one scan each.
 * A detection counts as correct when its selected options, joined with
 * commas, equal the keyed answer ignoring case and surrounding blanks.
 */
public class ItemTally {

    private final Map<Integer, String> key;
    private final Map<Integer, Integer> correctCounts = new TreeMap<>();
    private int studentsTookExam;
    private int totalCorrect;

    public ItemTally(AnswerKey answerKey) {
        this(normalizedKey(answerKey));
    }

    private ItemTally(Map<Integer, String> key) {
        this.key = key;
        key.keySet().forEach(questionId -> correctCounts.put(questionId, 0));
    }

    /** Counts one student's detections. */
    public void record(DetectionResult detection) {
        studentsTookExam++;
        Set<Integer> seen = new HashSet<>();
        for (QuestionDetection d : detection.detections()) {
            String correct = key.get(d.questionId());
            if (correct == null || !seen.add(d.questionId())) {
                continue;
            }
            String answer = normalize(String.join(",", d.selected()));
            if (!answer.isEmpty() && answer.equals(correct)) {
                correctCounts.merge(d.questionId(), 1, Integer::sum);
                totalCorrect++;
            }
        }
    }

    /** Sums counts and populations; percentages are recomputed from the sums. */
    public static ItemTally merge(AnswerKey answerKey, Collection<ItemTally> tallies) {
        ItemTally merged = new ItemTally(answerKey);
        for (ItemTally tally : tallies) {
            merged.studentsTookExam += tally.studentsTookExam;
            merged.totalCorrect += tally.totalCorrect;
            tally.correctCounts.forEach((questionId, count) -> merged.correctCounts.merge(questionId, count,
                    Integer::sum));
        }
        return merged;
    }

    public int studentsTookExam() {
        return studentsTookExam;
    }

    public int totalCorrect() {
        return totalCorrect;
    }

    public int questionCount() {
        return key.size();
    }

    public int correctCount(int questionId) {
        return correctCounts.getOrDefault(questionId, 0);
    }

    /** Unrounded share of students who answered the question correctly. */
    public double percentage(int questionId) {
        return studentsTookExam > 0 ? (correctCount(questionId) * 100.0) / studentsTookExam : 0;
    }

    /** One row per keyed question, by question number, ranked within this tally. */
    public List<ItemRow> toRows() {
        List<ItemRanker.Entry> entries = new ArrayList<>();
        for (Integer questionId : correctCounts.keySet()) {
            entries.add(new ItemRanker.Entry(questionId, Rounding.twoDecimals(percentage(questionId))));
        }
        Map<Integer, ItemRanker.Rank> ranks = ItemRanker.rank(entries);

        List<ItemRow> rows = new ArrayList<>(entries.size());
        for (ItemRanker.Entry entry : entries) {
            int questionId = entry.questionNumber();
            ItemRanker.Rank rank = ranks.get(questionId);
            rows.add(new ItemRow(questionId, correctCount(questionId), studentsTookExam, entry.percentage(),
                    Remark.of(percentage(questionId)), rank.label(), rank.numbers()));
        }
        return rows;
    }

    private static Map<Integer, String> normalizedKey(AnswerKey answerKey) {
        Map<Integer, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<Integer, KeyedAnswer> entry : answerKey.byQuestion().entrySet()) {
            normalized.put(entry.getKey(), normalize(entry.getValue().correct()));
        }
        return normalized;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }
}
