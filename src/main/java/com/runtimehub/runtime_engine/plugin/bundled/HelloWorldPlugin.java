package com.runtimehub.runtime_engine.plugin.bundled;

import com.runtimehub.runtime_engine.executor.NodeConfig;
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
import java.util.List;
import java.util.Map;

/** Greets {@code name}, from the input or config, defaulting to "World". */
@Slf4j
public class HelloWorldPlugin implements NodePlugin {

    @Override
    public String getName() {
        return "Example Plugin";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public String getDescription() {
        return "Example plugin with Hello World node";
    }

    @Override
    public List<PluginNode> getNodes() {
        return List.of(new PluginNode(new HelloWorldExecutor(), PortMap.of(List.of("name"), List.of("greeting"))));
    }

    static class HelloWorldExecutor implements NodeExecutor {

        @Override
        public String supportedType() {
            return "Hello World";
        }

        @Override
        public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                                   Map<String, Object> inputs) {
            String name = NodeConfig.string(node, inputs, "name", "World");
            String greeting = "Hello, " + name + "!";
            log.info(greeting);
            return NodeOutcome.next(Map.of("greeting", greeting, "timestamp", Instant.now().toString()));
        }
    }
}
