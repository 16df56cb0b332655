package com.bubblegrade.exception;

/**
 * Grading could not be computed for a scan. Never reaches an HTTP caller: the
 * ingestion and manual-edit paths catch it and keep the detection facts.
 */
public class GradingException extends RuntimeException {

    public GradingException(String message) {
        super(message);
    }

    public GradingException(String message, Throwable cause) {
        super(message, cause);
    }
}
