package com.quantlab.orchestrator.notification;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes job events on a Redis pub/sub topic so that other processes (WebSocket gateways,
 * additional orchestrator instances) can forward them to clients.
 * Channel name: {@code <topic>:<strategyId>}.
 */
@Component
@ConditionalOnProperty(prefix = "orchestrator.notifications.redis", name = "enabled", havingValue = "true")
@Slf4j
public class RedisJobEventChannel implements JobEventChannel {

    private final RedisTemplate<String, Object> redisTemplate;
    private final String topic;

    public RedisJobEventChannel(@Qualifier("jobEventRedisTemplate") RedisTemplate<String, Object> redisTemplate,
                                OrchestratorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.topic = properties.getNotifications().getRedis().getTopic();
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public void send(JobEvent event) {
        String channel = topic + ":" + event.getStrategyId();
        try {
            redisTemplate.convertAndSend(channel, event);
            log.debug("Published {} event for job {} to Redis channel {}", event.getType(), event.getJobId(), channel);
        } catch (DataAccessException e) {
            throw new IllegalStateException("Failed to publish job event to Redis channel " + channel, e);
        }
    }
}
