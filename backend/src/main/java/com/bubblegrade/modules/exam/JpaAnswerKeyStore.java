package com.bubblegrade.modules.exam;

import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.grading.GradingPolicy;
import com.bubblegrade.modules.grading.KeyedAnswer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAnswerKeyStore implements AnswerKeyStore {

    private static final TypeReference<List<KeyedAnswer>> ANSWERS = new TypeReference<>() {
    };

    private final ExamRepository examRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<AnswerKey> findByExamId(UUID examId) {
        return examRepository.findByIdAndIsActiveTrue(examId).map(this::toAnswerKey);
    }

    AnswerKey toAnswerKey(Exam exam) {
        try {
            List<KeyedAnswer> answers = exam.getAnswers() == null
                    ? List.of()
                    : objectMapper.readValue(exam.getAnswers(), ANSWERS);
            GradingPolicy policy = exam.getGradingPolicy() == null
                    ? GradingPolicy.DEFAULT
                    : objectMapper.readValue(exam.getGradingPolicy(), GradingPolicy.class);
            return new AnswerKey(exam.getId(), exam.getTemplateId(), answers, policy);
        } catch (JsonProcessingException e) {
            log.error("Exam {} has an unreadable answer key", exam.getId(), e);
            throw new IllegalStateException("Unreadable answer key for exam " + exam.getId(), e);
        }
    }
}
