package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Compares {@code condition} against {@code value} and follows the "true" or "false" port.
 *
 * Config: { "condition": "yes", "operator": "equals" | "not_equals" | "contains", "value": "yes" }
 * A value arriving on the condition input overrides the configured one.
 */
@Component
public class ConditionExecutor implements NodeExecutor {

    @Override
    public String supportedType() {
        return "Condition";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        String condition = NodeConfig.string(node, inputs, "condition", "");
        String operator = NodeConfig.string(node, "operator", "equals");
        String value = NodeConfig.string(node, "value", "");

        boolean result = evaluate(condition, operator, value);
        String branch = result ? "true" : "false";
        return NodeOutcome.branch(branch, Map.of("result", result, "branch", branch));
    }

    static boolean evaluate(String condition, String operator, String value) {
        return switch (operator) {
            case "equals"     -> condition.equals(value);
            case "not_equals" -> !condition.equals(value);
            case "contains"   -> condition.contains(value);
            default           -> false;
        };
    }
}
