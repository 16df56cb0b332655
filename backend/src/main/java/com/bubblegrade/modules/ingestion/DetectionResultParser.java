package com.bubblegrade.modules.ingestion;

import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads one result message from the vision worker. Field names are snake_case;
 * unknown fields are ignored.
 */
@Component
@RequiredArgsConstructor
public class DetectionResultParser {

    private final ObjectMapper objectMapper;

    public DetectionResult parse(String message) throws MalformedResultException {
        if (message == null || message.isBlank()) {
            throw new MalformedResultException("Empty result message", null);
        }
        DetectionResult result;
        try {
            result = objectMapper.readValue(message, DetectionResult.class);
        } catch (JsonProcessingException e) {
            throw new MalformedResultException("Unparseable result message: " + e.getOriginalMessage(), e);
        }
        if (result.scanId() == null || result.scanId().isBlank()) {
            throw new MalformedResultException("Result message has no scan_id", null);
        }
        if (result.status() == null) {
            throw new MalformedResultException("Result for scan " + result.scanId() + " has no status", null);
        }
        return result;
    }

    public static class MalformedResultException extends Exception {

        public MalformedResultException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
