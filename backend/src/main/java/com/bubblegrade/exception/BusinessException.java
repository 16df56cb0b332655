package com.bubblegrade.exception;

/**
 * A request that is well-formed but violates a business rule (missing report
 * parameter, exam outside the class, empty answer key...). Mapped to 400.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
