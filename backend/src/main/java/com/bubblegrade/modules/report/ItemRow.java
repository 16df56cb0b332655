package com.bubblegrade.modules.report;

import java.util.List;

/**
 * Item analysis of one question.
 *
 * @param percentage correct_count / students_took_exam * 100, rounded to two decimals
 */
public record ItemRow(
        int questionNumber,
        int correctCount,
        int studentsTookExam,
        double percentage,
        Remark remark,
        String rankLabel,
        List<Integer> rankNumbers) {

    public ItemRow {
        rankNumbers = rankNumbers == null ? List.of() : List.copyOf(rankNumbers);
    }
}
