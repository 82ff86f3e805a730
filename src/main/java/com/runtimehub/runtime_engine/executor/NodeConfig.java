package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.NodeDefinition;

import java.util.Map;

/**
 * Typed reads from a node's free-form config, with inputs taking precedence where a value
 * may come from either.
 */
public final class NodeConfig {

    private NodeConfig() {
    }

    public static Object value(NodeDefinition node, Map<String, Object> inputs, String key) {
        if (inputs != null && inputs.get(key) != null) {
            return inputs.get(key);
        }
        return node.config().get(key);
    }

    public static String string(NodeDefinition node, String key, String defaultValue) {
        Object value = node.config().get(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    public static String string(NodeDefinition node, Map<String, Object> inputs, String key, String defaultValue) {
        Object value = value(node, inputs, key);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    public static long number(NodeDefinition node, Map<String, Object> inputs, String key, long defaultValue) {
        return toLong(value(node, inputs, key), defaultValue);
    }

    public static long number(NodeDefinition node, String key, long defaultValue) {
        return toLong(node.config().get(key), defaultValue);
    }

    public static boolean flag(NodeDefinition node, String key) {
        Object value = node.config().get(key);
        return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    public static long toLong(Object value, long defaultValue) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return (long) Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
