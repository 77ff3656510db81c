package com.quantlab.orchestrator.notification;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import com.quantlab.orchestrator.domain.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for publishing job events on Redis pub/sub.
 */
@ExtendWith(MockitoExtension.class)
class RedisJobEventChannelTest {

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    private RedisJobEventChannel channel;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getNotifications().getRedis().setTopic("job-events");
        channel = new RedisJobEventChannel(redisTemplate, properties);
    }

    @Test
    void testSend_PublishesOnStrategyChannel() {
        // Arrange
        JobEvent event = event();

        // Act
        channel.send(event);

        // Assert
        verify(redisTemplate).convertAndSend("job-events:7", event);
    }

    @Test
    void testSend_WrapsRedisFailure() {
        when(redisTemplate.convertAndSend(anyString(), any())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThrows(IllegalStateException.class, () -> channel.send(event()));
    }

    private JobEvent event() {
        return JobEvent.builder()
                .type(JobEventType.TERMINAL)
                .jobId(11L)
                .strategyId(7L)
                .status(JobStatus.COMPLETED)
                .progress(100.0)
                .build();
    }
}
