package com.bubblegrade.modules.report;

import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.grading.KeyedAnswer;
import com.bubblegrade.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.bubblegrade.support.Fixtures.answered;
import static com.bubblegrade.support.Fixtures.unanswered;
import static org.assertj.core.api.Assertions.assertThat;

class ItemTallyTest {

    private final AnswerKey key = Fixtures.twoQuestionKey(UUID.randomUUID());

    @Test
    void countsCorrectAnswersPerQuestion() {
        ItemTally tally = new ItemTally(key);
        tally.record(Fixtures.success("s1", answered(1, "A"), answered(2, "B")));
        tally.record(Fixtures.success("s2", answered(1, "a"), answered(2, "C")));
        tally.record(Fixtures.success("s3", answered(1, "A"), unanswered(2)));
        tally.record(Fixtures.success("s4", answered(1, "C"), answered(2, "A", "B")));

        assertThat(tally.studentsTookExam()).isEqualTo(4);
        assertThat(tally.correctCount(1)).isEqualTo(3);
        assertThat(tally.correctCount(2)).isEqualTo(1);
        assertThat(tally.totalCorrect()).isEqualTo(4);

        List<ItemRow> rows = tally.toRows();
        assertThat(rows).extracting(ItemRow::questionNumber).containsExactly(1, 2);
        assertThat(rows.get(0).percentage()).isEqualTo(75.0);
        assertThat(rows.get(0).remark()).isEqualTo(Remark.M);
        assertThat(rows.get(0).rankLabel()).isEqualTo("1");
        assertThat(rows.get(1).percentage()).isEqualTo(25.0);
        assertThat(rows.get(1).remark()).isEqualTo(Remark.NTM);
        assertThat(rows.get(1).rankLabel()).isEqualTo("2");
    }

    @Test
    void questionReportedTwiceCountsOnce() {
        ItemTally tally = new ItemTally(key);
        tally.record(Fixtures.success("s1", answered(1, "A"), answered(1, "A")));

        assertThat(tally.correctCount(1)).isEqualTo(1);
        assertThat(tally.totalCorrect()).isEqualTo(1);
    }

    @Test
    void unkeyedQuestionsAreIgnored() {
        ItemTally tally = new ItemTally(key);
        tally.record(Fixtures.success("s1", answered(7, "A")));

        assertThat(tally.totalCorrect()).isZero();
        assertThat(tally.toRows()).hasSize(2);
    }

    @Test
    void percentagesAreRoundedForDisplayOnly() {
        ItemTally tally = new ItemTally(key);
        tally.record(Fixtures.success("s1", answered(1, "A"), answered(2, "B")));
        tally.record(Fixtures.success("s2", answered(1, "A"), answered(2, "B")));
        tally.record(Fixtures.success("s3", answered(1, "B"), answered(2, "B")));

        List<ItemRow> rows = tally.toRows();
        assertThat(rows.get(0).percentage()).isEqualTo(66.67);
        assertThat(rows.get(0).remark()).isEqualTo(Remark.NM);
        assertThat(rows.get(1).percentage()).isEqualTo(100.0);
        assertThat(rows.get(1).rankLabel()).isEqualTo("1");
        assertThat(rows.get(0).rankLabel()).isEqualTo("2");
    }

    @Test
    void keyedAnswersAreComparedWithoutCaseOrBlanks() {
        AnswerKey lowerCaseKey = new AnswerKey(UUID.randomUUID(), Fixtures.TEMPLATE,
                List.of(new KeyedAnswer(1, " b ", 1.0)), null);
        ItemTally tally = new ItemTally(lowerCaseKey);
        tally.record(Fixtures.success("s1", answered(1, "B")));

        assertThat(tally.correctCount(1)).isEqualTo(1);
    }

    @Test
    void mergeRecomputesPercentagesFromSums() {
        ItemTally a = new ItemTally(key);
        a.record(Fixtures.success("s1", answered(1, "A"), answered(2, "B")));
        ItemTally b = new ItemTally(key);
        b.record(Fixtures.success("s2", answered(1, "C"), answered(2, "B")));
        b.record(Fixtures.success("s3", answered(1, "C"), answered(2, "B")));

        ItemTally merged = ItemTally.merge(key, List.of(a, b));

        assertThat(merged.studentsTookExam()).isEqualTo(3);
        assertThat(merged.correctCount(1)).isEqualTo(1);
        assertThat(merged.percentage(1)).isEqualTo(100.0 / 3);
        assertThat(merged.totalCorrect()).isEqualTo(4);
    }

    @Test
    void remarkUsesUnroundedPercentage() {
        assertThat(Remark.of(74.999)).isEqualTo(Remark.NM);
        assertThat(Remark.of(75)).isEqualTo(Remark.M);
        assertThat(Remark.of(60)).isEqualTo(Remark.NM);
        assertThat(Remark.of(59.99)).isEqualTo(Remark.NTM);
    }
}
