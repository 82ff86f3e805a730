package com.runtimehub.runtime_engine.engine;

import java.util.Map;

/**
 * Transport for engine events. Implementations may throw; the publisher logs and drops the failure.
 */
public interface EventSink {

    void send(String event, Map<String, Object> payload);
}
