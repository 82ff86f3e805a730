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
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logs the incoming data at the configured level, keeps it in {@link PluginLogStore} and
 * passes it through unchanged on the output port.
 */
@Slf4j
public class LoggerPlugin implements NodePlugin {

    @Override
    public String getName() {
        return "Logger Plugin";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public String getDescription() {
        return "Logs workflow data with timestamps and configurable levels";
    }

    @Override
    public List<PluginNode> getNodes() {
        return List.of(new PluginNode(new LoggerExecutor(PluginLogStore.shared()),
                PortMap.of(List.of("data"), List.of("output", "logged"))));
    }

    static class LoggerExecutor implements NodeExecutor {

        private final ObjectMapper objectMapper = new ObjectMapper();
        private final PluginLogStore store;

        LoggerExecutor(PluginLogStore store) {
            this.store = store;
        }

        @Override
        public String supportedType() {
            return "Logger";
        }

        @Override
        public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                                   Map<String, Object> inputs) {
            Map<String, Object> config = node.config();
            String level = String.valueOf(config.getOrDefault("level", "info"));
            String prefix = config.get("prefix") != null ? "[" + config.get("prefix") + "]" : "";
            Object data = inputs.containsKey("data") ? inputs.get("data") : config.get("defaultData");
            String timestamp = Instant.now().toString();

            PluginLogStore.Entry entry = new PluginLogStore.Entry(timestamp, level.toUpperCase(), prefix,
                    run.getId(), node.id(), data, prefix + render(data));
            store.append(entry);

            switch (level) {
                case "error" -> log.error("{} {}", entry.level(), entry.message());
                case "warn" -> log.warn("{} {}", entry.level(), entry.message());
                case "debug" -> log.debug("{} {}", entry.level(), entry.message());
                default -> log.info("{} {}", entry.level(), entry.message());
            }

            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put("output", data);
            outputs.put("logged", true);
            outputs.put("timestamp", timestamp);
            outputs.put("level", level);
            outputs.put("entry", entry);
            return NodeOutcome.next(outputs);
        }

        private String render(Object data) {
            try {
                return objectMapper.writeValueAsString(data);
            } catch (JsonProcessingException e) {
                return String.valueOf(data);
            }
        }
    }
}
