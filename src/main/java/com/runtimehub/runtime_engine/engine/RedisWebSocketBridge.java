package com.runtimehub.runtime_engine.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Relays engine events through Redis pub/sub. A run executing on one instance publishes here;
 * every instance, itself included, forwards the message to its own WebSocket clients.
 */
@Slf4j
public class RedisWebSocketBridge implements MessageListener {

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;

    public RedisWebSocketBridge(StringRedisTemplate redisTemplate,
                                SimpMessagingTemplate messagingTemplate,
                                ObjectMapper objectMapper,
                                String channel) {
        this.redisTemplate = redisTemplate;
        this.messagingTemplate = messagingTemplate;
        this.objectMapper = objectMapper;
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }

    public void publish(String destination, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(new StompMessage(destination, payload));
            redisTemplate.convertAndSend(channel, json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            StompMessage stomp = objectMapper.readValue(body, StompMessage.class);
            messagingTemplate.convertAndSend(stomp.destination(), stomp.payload());
        } catch (Exception e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    record StompMessage(String destination, Map<String, Object> payload) {}
}
