package com.bubblegrade.modules.ingestion;

import com.bubblegrade.config.ScanningProperties;
import com.bubblegrade.modules.scan.detection.DetectionResult;
import com.bubblegrade.support.Fixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectionResultConsumerTest {

    private static final String VALID = """
            {"scan_id": "scan-1", "template_id": "tpl-20q", "status": "success",
             "detections": [{"question_id": 1, "selected": ["A"], "detection_status": "answered"}]}
            """;

    @Mock
    private RedisTemplate<String, String> redisTemplate;
    @Mock
    private ListOperations<String, String> listOperations;
    @Mock
    private DetectionResultApplier applier;

    private final ObjectMapper objectMapper = Fixtures.objectMapper();
    private final ScanningProperties properties = new ScanningProperties();
    private DetectionResultConsumer consumer;

    @BeforeEach
    void setUp() {
        properties.setPopTimeoutSeconds(1);
        properties.setErrorBackoffMillis(10);
        lenient().when(redisTemplate.opsForList()).thenReturn(listOperations);
        consumer = new DetectionResultConsumer(redisTemplate, new DetectionResultParser(objectMapper), applier,
                properties, objectMapper, Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC));
    }

    private void nextMessage(String message) {
        when(listOperations.rightPop("scan_results", Duration.ofSeconds(1))).thenReturn(message);
    }

    @Test
    void timeoutIsNotAnOutcome() {
        nextMessage(null);

        assertThat(consumer.pollOnce()).isNull();
        verifyNoInteractions(applier);
    }

    @Test
    void appliesParsedResult() {
        nextMessage(VALID);
        when(applier.apply(any(DetectionResult.class))).thenReturn(IngestionOutcome.APPLIED);

        assertThat(consumer.pollOnce()).isEqualTo(IngestionOutcome.APPLIED);

        ArgumentCaptor<DetectionResult> captor = ArgumentCaptor.forClass(DetectionResult.class);
        verify(applier).apply(captor.capture());
        assertThat(captor.getValue().scanId()).isEqualTo("scan-1");
        verify(listOperations, never()).leftPush(anyString(), anyString());
    }

    @Test
    void malformedMessageIsDeadLettered() throws Exception {
        nextMessage("{broken");

        assertThat(consumer.pollOnce()).isEqualTo(IngestionOutcome.MALFORMED);

        ArgumentCaptor<String> entry = ArgumentCaptor.forClass(String.class);
        verify(listOperations).leftPush(eq("scan_results:dead"), entry.capture());
        JsonNode json = objectMapper.readTree(entry.getValue());
        assertThat(json.get("reason").asText()).isEqualTo("MALFORMED");
        assertThat(json.get("message").asText()).isEqualTo("{broken");
        assertThat(json.get("dropped_at").asText()).isEqualTo("2026-03-02T08:00:00Z");
        verifyNoInteractions(applier);
    }

    @Test
    void droppedResultIsDeadLettered() throws Exception {
        nextMessage(VALID);
        when(applier.apply(any(DetectionResult.class))).thenReturn(IngestionOutcome.UNKNOWN_SCAN);

        assertThat(consumer.pollOnce()).isEqualTo(IngestionOutcome.UNKNOWN_SCAN);

        ArgumentCaptor<String> entry = ArgumentCaptor.forClass(String.class);
        verify(listOperations).leftPush(eq("scan_results:dead"), entry.capture());
        assertThat(objectMapper.readTree(entry.getValue()).get("detail").asText()).isEqualTo("scan scan-1");
    }

    @Test
    void rejectedResultIsNotDeadLettered() {
        nextMessage(VALID);
        when(applier.apply(any(DetectionResult.class))).thenReturn(IngestionOutcome.REJECTED);

        consumer.pollOnce();

        verify(listOperations, never()).leftPush(anyString(), anyString());
    }

    @Test
    void deadLetteringCanBeDisabled() {
        properties.setDeadLetterEnabled(false);
        nextMessage("{broken");

        assertThat(consumer.pollOnce()).isEqualTo(IngestionOutcome.MALFORMED);
        verify(listOperations, never()).leftPush(anyString(), anyString());
    }

    @Test
    void deadLetterFailureDoesNotEscape() {
        nextMessage("{broken");
        when(listOperations.leftPush(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection reset"));

        assertThat(consumer.pollOnce()).isEqualTo(IngestionOutcome.MALFORMED);
    }

    @Test
    void loopSurvivesFailingIterationsAndStops() {
        when(listOperations.rightPop("scan_results", Duration.ofSeconds(1)))
                .thenThrow(new RedisConnectionFailureException("redis down"))
                .thenReturn(VALID)
                .thenReturn(null);
        when(applier.apply(any(DetectionResult.class))).thenReturn(IngestionOutcome.APPLIED);

        consumer.start();
        try {
            assertThat(consumer.isRunning()).isTrue();
            verify(applier, timeout(2000)).apply(any(DetectionResult.class));
        } finally {
            consumer.stop();
        }

        assertThat(consumer.isRunning()).isFalse();
    }

    @Test
    void autoStartupFollowsConfiguration() {
        properties.setConsumerAutoStartup(false);

        assertThat(consumer.isAutoStartup()).isFalse();
    }
}
