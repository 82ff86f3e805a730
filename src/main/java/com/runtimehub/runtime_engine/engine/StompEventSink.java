package com.runtimehub.runtime_engine.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Delivers events to WebSocket clients subscribed to {@code /topic/<event>}. When the Redis
 * bridge is active the event is relayed through Redis so every instance delivers it.
 */
@Slf4j
@Component
public class StompEventSink implements EventSink {

    static final String TOPIC_PREFIX = "/topic/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public StompEventSink(SimpMessagingTemplate messagingTemplate,
                          ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    @Override
    public void send(String event, Map<String, Object> payload) {
        String destination = TOPIC_PREFIX + event;
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.trace("Publishing {} via {}", destination, bridge != null ? "Redis" : "STOMP");
        if (bridge != null) {
            bridge.publish(destination, payload);
        } else {
            messagingTemplate.convertAndSend(destination, payload);
        }
    }
}
