package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/*
 * Config shape:
 * {
 *   "duration": 1500,
 *   "unit":     "ms" | "seconds" | "minutes"
 * }
 */
@Slf4j
abstract class SleepingExecutor implements NodeExecutor {

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        long duration = NodeConfig.number(node, inputs, "duration", 1000);
        String unit = NodeConfig.string(node, "unit", "ms");
        long waitMillis = switch (unit) {
            case "seconds" -> duration * 1000;
            case "minutes" -> duration * 60_000;
            default        -> duration;
        };

        log.debug("Node {} waiting {} {}", node.id(), duration, unit);
        run.getCancellation().sleep(waitMillis);

        return NodeOutcome.next(Map.of("duration", waitMillis, "unit", unit, "completed", true));
    }
}

@Component
class DelayExecutor extends SleepingExecutor {
    @Override public String supportedType() { return "Delay"; }
}

@Component
class WaitExecutor extends SleepingExecutor {
    @Override public String supportedType() { return "Wait"; }
}
