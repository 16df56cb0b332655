package com.bubblegrade.exception;

/**
 * Another submission for the same exam and student committed first. Raised when
 * the active-scan unique index rejects a write.
 */
public class ConcurrentSubmissionException extends RuntimeException {

    public ConcurrentSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
