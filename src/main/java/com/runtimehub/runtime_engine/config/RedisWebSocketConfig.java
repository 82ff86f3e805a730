package com.runtimehub.runtime_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runtimehub.runtime_engine.engine.RedisWebSocketBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Multi-instance event fan-out through Redis pub/sub, enabled with
 * {@code runtime-hub.events.redis.enabled=true}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "runtime-hub.events.redis", name = "enabled", havingValue = "true")
public class RedisWebSocketConfig {

    @Bean
    public RedisWebSocketBridge redisWebSocketBridge(StringRedisTemplate redisTemplate,
                                                     SimpMessagingTemplate messagingTemplate,
                                                     ObjectMapper objectMapper,
                                                     RuntimeHubProperties properties) {
        String channel = properties.getEvents().getRedis().getChannel();
        log.info("Relaying engine events through Redis channel {}", channel);
        return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper, channel);
    }

    @Bean
    public RedisMessageListenerContainer redisWebSocketListenerContainer(RedisConnectionFactory connectionFactory,
                                                                         RedisWebSocketBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new ChannelTopic(bridge.getChannel()));
        return container;
    }
}
