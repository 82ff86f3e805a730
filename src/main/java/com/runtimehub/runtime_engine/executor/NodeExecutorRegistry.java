package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.engine.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
public class NodeExecutorRegistry {

    private final Map<String, NodeExecutor> registry = new LinkedHashMap<>();

    public NodeExecutorRegistry(List<NodeExecutor> executors) {
        executors.forEach(executor -> register(executor.supportedType(), executor));
    }

    public synchronized void register(String type, NodeExecutor executor) {
        NodeExecutor previous = registry.put(type, executor);
        if (previous != null && previous != executor) {
            log.warn("Executor for node type '{}' replaced by {}", type, executor.getClass().getSimpleName());
        }
    }

    public synchronized boolean has(String type) {
        return registry.containsKey(type);
    }

    public synchronized Optional<NodeExecutor> find(String type) {
        return Optional.ofNullable(registry.get(type));
    }

    public NodeExecutor get(String type) {
        return find(type).orElseThrow(() -> new ValidationException("Unknown node type: " + type));
    }

    public synchronized Set<String> types() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(registry.keySet()));
    }
}
