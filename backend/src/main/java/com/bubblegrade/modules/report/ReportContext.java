package com.bubblegrade.modules.report;

import com.bubblegrade.modules.exam.Exam;
import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.roster.Grade;
import com.bubblegrade.modules.roster.SchoolClass;
import com.bubblegrade.modules.roster.Section;

import java.util.List;

/**
 * Everything a report request needs, validated: the class has active
 * sections and the exam belongs to it with a usable key.
 */
public record ReportContext(
        Grade grade,
        SchoolClass schoolClass,
        Exam exam,
        AnswerKey answerKey,
        List<Section> sections) {

    public ReportContext {
        sections = List.copyOf(sections);
    }

    public double totalPoints() {
        return answerKey.totalPoints();
    }

    /** Highest row of the distribution tables. */
    public int topScore() {
        return (int) Math.round(totalPoints());
    }
}
