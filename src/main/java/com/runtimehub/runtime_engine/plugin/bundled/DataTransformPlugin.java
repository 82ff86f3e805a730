package com.runtimehub.runtime_engine.plugin.bundled;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runtimehub.runtime_engine.executor.NodeExecutor;
import com.runtimehub.runtime_engine.executor.NodeOutcome;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import com.runtimehub.runtime_engine.plugin.NodePlugin;
import com.runtimehub.runtime_engine.plugin.PluginNode;
import com.runtimehub.runtime_engine.port.PortMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * String and number conversions: uppercase, lowercase, trim, parse-as-number, parse-as-json.
 * A failed conversion is returned as data with {@code success=false}.
 */
public class DataTransformPlugin implements NodePlugin {

    @Override
    public String getName() {
        return "Data Transform Plugin";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public String getDescription() {
        return "Transforms string and number data with various operations";
    }

    @Override
    public List<PluginNode> getNodes() {
        return List.of(new PluginNode(new DataTransformExecutor(),
                PortMap.of(List.of("input"), List.of("output", "error"))));
    }

    static class DataTransformExecutor implements NodeExecutor {

        private final ObjectMapper objectMapper = new ObjectMapper();

        @Override
        public String supportedType() {
            return "Data Transform";
        }

        @Override
        public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                                   Map<String, Object> inputs) {
            Map<String, Object> config = node.config();
            String operation = String.valueOf(config.getOrDefault("operation", "uppercase"));

            Object input = inputs.containsKey("input") ? inputs.get("input") : config.getOrDefault("defaultInput", "");
            if (input == null || "".equals(input)) {
                input = config.getOrDefault("defaultValue", "");
            }
            if (input == null) {
                input = "";
            }

            Map<String, Object> outputs = new LinkedHashMap<>();
            try {
                outputs.put("output", transform(operation, input));
                outputs.put("operation", operation);
                outputs.put("original", input);
                outputs.put("success", true);
            } catch (IllegalArgumentException e) {
                outputs.put("error", e.getMessage());
                outputs.put("original", input);
                outputs.put("operation", operation);
                outputs.put("success", false);
            }
            return NodeOutcome.next(outputs);
        }

        Object transform(String operation, Object input) {
            return switch (operation) {
                case "uppercase" -> String.valueOf(input).toUpperCase();
                case "lowercase" -> String.valueOf(input).toLowerCase();
                case "trim" -> String.valueOf(input).trim();
                case "parse-as-number" -> parseNumber(input);
                case "parse-as-json" -> parseJson(input);
                default -> throw new IllegalArgumentException("Unknown operation: " + operation);
            };
        }

        private static Object parseNumber(Object input) {
            if (input instanceof Number) {
                return input;
            }
            if (input instanceof String text) {
                try {
                    return Double.parseDouble(text.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Cannot parse \"" + text + "\" as number");
                }
            }
            throw new IllegalArgumentException("Cannot parse " + input.getClass().getSimpleName() + " as number");
        }

        private Object parseJson(Object input) {
            if (input instanceof String text) {
                try {
                    return objectMapper.readValue(text, Object.class);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage());
                }
            }
            if (input instanceof Map || input instanceof List) {
                return input;
            }
            throw new IllegalArgumentException("Cannot parse " + input.getClass().getSimpleName() + " as JSON");
        }
    }
}
