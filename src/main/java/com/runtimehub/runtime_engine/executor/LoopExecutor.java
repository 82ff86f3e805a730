package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import com.runtimehub.runtime_engine.port.PortRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the nodes wired to the "item" port {@code iterations} times, then continues from
 * "loop_complete".
 *
 * Config: { "iterations": 3, "delayBetween": 250 }
 * The current 1-based iteration is exposed as the run variable {@code <loopNodeId>.iteration}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoopExecutor implements NodeExecutor {

    static final String BODY_PORT = "item";
    static final String EXIT_PORT = "loop_complete";

    private final PortRegistry portRegistry;

    @Override
    public String supportedType() {
        return "Loop";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        long iterations = Math.max(1, NodeConfig.number(node, "iterations", 1));
        long delayBetween = NodeConfig.number(node, "delayBetween", 0);

        List<NodeDefinition> body = connections.stream()
                .filter(c -> c.leaves(node.id()))
                .filter(c -> BODY_PORT.equals(portRegistry.outputName(node.type(), c.from().portIndex())))
                .map(c -> run.findNode(c.to().nodeId()))
                .flatMap(Optional::stream)
                .toList();

        List<Map<String, Object>> results = new ArrayList<>();
        for (int i = 0; i < iterations; i++) {
            if (run.isCancelled()) {
                break;
            }
            log.debug("Loop {} iteration {}/{}", node.id(), i + 1, iterations);
            run.getContext().setVariable(node.id() + ".iteration", i + 1);

            for (NodeDefinition target : body) {
                run.traverse(target);
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("iteration", i + 1);
                entry.put("nodeId", target.id());
                entry.put("result", run.getContext().getValue(target.id()));
                results.add(entry);
            }

            if (delayBetween > 0 && i < iterations - 1) {
                run.getCancellation().sleep(delayBetween);
            }
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("success", true);
        outputs.put("iterations", iterations);
        outputs.put("completed", results.size());
        outputs.put("results", results);
        return NodeOutcome.branch(EXIT_PORT, outputs);
    }
}
