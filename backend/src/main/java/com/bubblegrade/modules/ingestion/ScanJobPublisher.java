package com.bubblegrade.modules.ingestion;

import com.bubblegrade.config.ScanningProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Pushes detection jobs to the vision worker's queue. Runs after the scan row
 * is committed, so the worker never sees a job for a scan it cannot find.
 * Jobs are appended on the right; the worker pops from the left.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanJobPublisher {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final ScanningProperties properties;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void publish(ScanJob job) {
        try {
            String payload = objectMapper.writeValueAsString(job);
            redisTemplate.opsForList().rightPush(properties.getJobQueue(), payload);
            log.info("Queued detection job for scan {} (template={})", job.scanId(), job.templateId());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize job for scan " + job.scanId(), e);
        } catch (RuntimeException e) {
            // the scan is committed as queued; it stays there until re-uploaded
            log.error("Failed to queue detection job for scan {}: {}", job.scanId(), e.getMessage(), e);
            throw e;
        }
    }
}
