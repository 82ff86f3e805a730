package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import com.runtimehub.runtime_engine.port.PortRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a node's input map from the results of upstream nodes that already ran.
 */
@Component
@RequiredArgsConstructor
public class InputResolver {

    private final PortRegistry portRegistry;

    /**
     * Walks the incoming connections in order. Connections from nodes without a result, and
     * from control-flow-only ports, contribute nothing. When the upstream result has a key
     * named after the output port that value is used, otherwise the whole result. Later
     * connections into the same input port win.
     */
    public Map<String, Object> resolveInputs(NodeDefinition node, WorkflowRun run, List<Connection> connections) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        for (Connection connection : connections) {
            if (!connection.enters(node.id()) || connection.from() == null) {
                continue;
            }
            String sourceId = connection.from().nodeId();
            Map<String, Object> upstream = run.getContext().getValue(sourceId);
            if (upstream == null) {
                continue;
            }
            String sourceType = run.findNode(sourceId).map(NodeDefinition::type).orElse(null);
            String outputPort = portRegistry.outputName(sourceType, connection.from().portIndex());
            if (PortRegistry.isControlFlowOutput(outputPort)) {
                continue;
            }
            Object value = upstream.containsKey(outputPort) ? upstream.get(outputPort) : upstream;
            inputs.put(portRegistry.inputName(node.type(), connection.to().portIndex()), value);
        }
        return inputs;
    }
}
