package com.bubblegrade.modules.ingestion;

import com.bubblegrade.config.ScanningProperties;
import com.bubblegrade.support.Fixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanJobPublisherTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;
    @Mock
    private ListOperations<String, String> listOperations;

    private final ObjectMapper objectMapper = Fixtures.objectMapper();

    @Test
    void pushesSnakeCaseJobOntoTheRightOfTheQueue() throws Exception {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        ScanJobPublisher publisher = new ScanJobPublisher(redisTemplate, objectMapper, new ScanningProperties());

        publisher.publish(new ScanJob("scan-1", "abc.jpg", "tpl-20q"));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(listOperations).rightPush(eq("scan_jobs"), payload.capture());
        JsonNode json = objectMapper.readTree(payload.getValue());
        assertThat(json.get("scan_id").asText()).isEqualTo("scan-1");
        assertThat(json.get("image_path").asText()).isEqualTo("abc.jpg");
        assertThat(json.get("template_id").asText()).isEqualTo("tpl-20q");
    }

    @Test
    void redisFailureIsRethrown() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPush(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("refused"));
        ScanJobPublisher publisher = new ScanJobPublisher(redisTemplate, objectMapper, new ScanningProperties());

        assertThatThrownBy(() -> publisher.publish(new ScanJob("scan-1", "abc.jpg", "tpl-20q")))
                .isInstanceOf(RedisConnectionFailureException.class);
    }
}
