package com.bubblegrade.modules.exam;

import com.bubblegrade.modules.grading.AnswerKey;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only lookup of an exam's answer key.
 */
public interface AnswerKeyStore {

    /** Empty when the exam does not exist or is inactive. */
    Optional<AnswerKey> findByExamId(UUID examId);
}
