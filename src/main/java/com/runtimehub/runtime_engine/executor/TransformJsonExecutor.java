package com.runtimehub.runtime_engine.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural operations over JSON data.
 *
 * <p>The document comes from the data input or {@code config.input} (a JSON string or an
 * object). The operation comes from the transformation input or {@code config.operation}:
 * get, set, pick, omit, filter, map, merge, keys, values, stringify, parse. Failures are
 * reported as {@code {success: false, error}} rather than thrown.
 */
@Component
@RequiredArgsConstructor
public class TransformJsonExecutor implements NodeExecutor {

    private final ObjectMapper objectMapper;

    @Override
    public String supportedType() {
        return "Transform JSON";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        String operation = inputs.get("transformation") instanceof String s && !s.isBlank()
                ? s
                : NodeConfig.string(node, "operation", "get");

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("operation", operation);

        Object input;
        try {
            input = readInput(inputs.containsKey("data") ? inputs.get("data") : node.config().get("input"));
        } catch (JsonProcessingException e) {
            outputs.put("success", false);
            outputs.put("error", "Invalid JSON input");
            return NodeOutcome.next(outputs);
        }

        try {
            outputs.put("result", apply(operation, input, node.config()));
            outputs.put("success", true);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            outputs.put("success", false);
            outputs.put("error", e.getMessage());
        }
        return NodeOutcome.next(outputs);
    }

    private Object readInput(Object raw) throws JsonProcessingException {
        if (raw == null) {
            return new LinkedHashMap<String, Object>();
        }
        if (raw instanceof String text) {
            return objectMapper.readValue(text, Object.class);
        }
        return raw;
    }

    Object apply(String operation, Object input, Map<String, Object> config) throws JsonProcessingException {
        String key = config.get("key") != null ? String.valueOf(config.get("key")) : "";
        return switch (operation) {
            case "get" -> getPath(input, key);
            case "set" -> {
                Object copy = deepCopy(input);
                setPath(copy, key, config.get("value"));
                yield copy;
            }
            case "pick" -> {
                Map<String, Object> source = asMap(input, operation);
                Map<String, Object> picked = new LinkedHashMap<>();
                for (String k : splitKeys(config.get("keys"))) {
                    if (source.containsKey(k)) {
                        picked.put(k, source.get(k));
                    }
                }
                yield picked;
            }
            case "omit" -> {
                Set<String> omitted = Set.copyOf(splitKeys(config.get("keys")));
                Map<String, Object> kept = new LinkedHashMap<>(asMap(input, operation));
                kept.keySet().removeAll(omitted);
                yield kept;
            }
            case "filter" -> {
                String[] filter = String.valueOf(config.getOrDefault("filter", "=")).split("=", 2);
                String filterKey = filter[0].trim();
                String filterValue = filter.length > 1 ? filter[1].trim() : "";
                yield asList(input, operation).stream()
                        .filter(item -> item instanceof Map<?, ?> m && filterValue.equals(String.valueOf(m.get(filterKey))))
                        .toList();
            }
            case "map" -> asList(input, operation).stream()
                    .map(item -> item instanceof Map<?, ?> m && m.containsKey(key) ? m.get(key) : item)
                    .toList();
            case "merge" -> {
                Map<String, Object> merged = new LinkedHashMap<>(asMap(input, operation));
                merged.putAll(readMerge(config.get("merge")));
                yield merged;
            }
            case "keys" -> new ArrayList<>(asMap(input, operation).keySet());
            case "values" -> new ArrayList<>(asMap(input, operation).values());
            case "stringify" -> objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(input);
            case "parse" -> input instanceof String text ? objectMapper.readValue(text, Object.class) : input;
            default -> input;
        };
    }

    private Map<String, Object> readMerge(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            return objectMapper.convertValue(map, new TypeReference<Map<String, Object>>() {});
        }
        if (raw == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(String.valueOf(raw), new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            return Map.of();
        }
    }

    private Object deepCopy(Object input) throws JsonProcessingException {
        return objectMapper.readValue(objectMapper.writeValueAsString(input), Object.class);
    }

    private static Object getPath(Object input, String path) {
        Object current = input;
        for (String segment : path.split("\\.")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && segment.chars().allMatch(Character::isDigit)) {
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    private static void setPath(Object target, String path, Object value) {
        if (!(target instanceof Map)) {
            throw new IllegalArgumentException("Input must be an object for set");
        }
        String[] keys = path.split("\\.");
        Map<String, Object> current = (Map<String, Object>) target;
        for (int i = 0; i < keys.length - 1; i++) {
            Object next = current.get(keys[i]);
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                current.put(keys[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(keys[keys.length - 1], value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object input, String operation) {
        if (input instanceof Map<?, ?>) {
            return (Map<String, Object>) input;
        }
        throw new IllegalArgumentException("Input must be an object for " + operation);
    }

    private static List<?> asList(Object input, String operation) {
        if (input instanceof List<?> list) {
            return list;
        }
        throw new IllegalArgumentException("Input must be an array for " + operation);
    }

    private static List<String> splitKeys(Object keys) {
        if (keys == null) {
            return List.of();
        }
        return Arrays.stream(String.valueOf(keys).split(","))
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toList());
    }
}
