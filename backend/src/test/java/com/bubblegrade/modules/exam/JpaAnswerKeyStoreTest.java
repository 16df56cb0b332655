package com.bubblegrade.modules.exam;

import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.grading.GradingPolicy;
import com.bubblegrade.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaAnswerKeyStoreTest {

    private static final UUID EXAM_ID = UUID.randomUUID();

    @Mock
    private ExamRepository examRepository;

    private Exam exam(String answers, String policy) {
        return Exam.builder().id(EXAM_ID).name("Quiz").templateId(Fixtures.TEMPLATE).answers(answers)
                .gradingPolicy(policy).createdBy("teacher-1").build();
    }

    @Test
    void readsKeyAndPolicyFromExamJson() {
        when(examRepository.findByIdAndIsActiveTrue(EXAM_ID)).thenReturn(Optional.of(exam("""
                [{"question_id": 1, "correct": "A", "points": 2},
                 {"question_id": 2, "correct": "C"}]
                """, """
                {"partial_credit": false, "penalty_incorrect": 0.25}
                """)));
        JpaAnswerKeyStore store = new JpaAnswerKeyStore(examRepository, Fixtures.objectMapper());

        AnswerKey key = store.findByExamId(EXAM_ID).orElseThrow();

        assertThat(key.templateId()).isEqualTo(Fixtures.TEMPLATE);
        assertThat(key.totalPoints()).isEqualTo(3.0);
        assertThat(key.policy().penaltyIncorrect()).isEqualTo(0.25);
        assertThat(key.policy().requireManualReviewOnAmbiguity()).isTrue();
    }

    @Test
    void missingPolicyFallsBackToDefault() {
        JpaAnswerKeyStore store = new JpaAnswerKeyStore(examRepository, Fixtures.objectMapper());

        AnswerKey key = store.toAnswerKey(exam("[]", null));

        assertThat(key.isEmpty()).isTrue();
        assertThat(key.policy()).isEqualTo(GradingPolicy.DEFAULT);
    }

    @Test
    void inactiveExamHasNoKey() {
        when(examRepository.findByIdAndIsActiveTrue(EXAM_ID)).thenReturn(Optional.empty());

        assertThat(new JpaAnswerKeyStore(examRepository, Fixtures.objectMapper()).findByExamId(EXAM_ID)).isEmpty();
    }

    @Test
    void unreadableKeyIsAnError() {
        JpaAnswerKeyStore store = new JpaAnswerKeyStore(examRepository, Fixtures.objectMapper());

        assertThatThrownBy(() -> store.toAnswerKey(exam("{not an array", null)))
                .isInstanceOf(IllegalStateException.class);
    }
}
