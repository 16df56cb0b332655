package com.bubblegrade.modules.ingestion;

import com.bubblegrade.config.ScanningProperties;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single background worker draining the vision worker's result queue.
 *
 * <p>Each iteration blocks on the queue for at most the configured timeout so
 * a stop request is noticed between iterations. Messages are handled one at a
 * time, in the order popped. A failing iteration is logged and followed by a
 * short pause; the loop itself only ends on {@link #stop()}.
 *
 * <p>Messages that cannot be applied are not retried. When dead-lettering is
 * enabled they are copied, with the reason, to a separate list for inspection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectionResultConsumer implements SmartLifecycle {

    private final RedisTemplate<String, String> redisTemplate;
    private final DetectionResultParser parser;
    private final DetectionResultApplier applier;
    private final ScanningProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread worker;

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        worker = new Thread(this::run, "detection-result-consumer");
        worker.setDaemon(true);
        worker.start();
        log.info("Detection result consumer started on queue '{}'", properties.getResultQueue());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread current = worker;
        if (current != null) {
            try {
                // at most one pop timeout plus the message in hand
                current.join(Duration.ofSeconds(properties.getPopTimeoutSeconds() + 5L).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Detection result consumer stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isConsumerAutoStartup();
    }

    private void run() {
        while (running.get()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                log.error("Detection result consumer iteration failed: {}", e.getMessage(), e);
                backoff();
            }
        }
    }

    /**
     * One loop iteration: pop at most one message and handle it.
     *
     * @return the outcome, or {@code null} when the pop timed out
     */
    public IngestionOutcome pollOnce() {
        String message = redisTemplate.opsForList()
                .rightPop(properties.getResultQueue(), Duration.ofSeconds(properties.getPopTimeoutSeconds()));
        if (message == null) {
            return null;
        }

        DetectionResult result;
        try {
            result = parser.parse(message);
        } catch (DetectionResultParser.MalformedResultException e) {
            log.warn("Dropping malformed detection result: {}", e.getMessage());
            deadLetter(message, IngestionOutcome.MALFORMED, e.getMessage());
            return IngestionOutcome.MALFORMED;
        }

        IngestionOutcome outcome = applier.apply(result);
        if (outcome.isDropped()) {
            deadLetter(message, outcome, "scan " + result.scanId());
        }
        return outcome;
    }

    private void deadLetter(String message, IngestionOutcome outcome, String detail) {
        if (!properties.isDeadLetterEnabled()) {
            return;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("reason", outcome.name());
        entry.put("detail", detail);
        entry.put("dropped_at", clock.instant().toString());
        entry.put("message", message);
        try {
            redisTemplate.opsForList().leftPush(properties.getDeadLetterQueue(), objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException | RuntimeException e) {
            // the message is already gone from the result queue; keep consuming
            log.error("Could not dead-letter dropped result ({}): {}", outcome, e.getMessage());
        }
    }

    private void backoff() {
        try {
            Thread.sleep(properties.getErrorBackoffMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }
}
