package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.engine.ScriptRunner;
import com.runtimehub.runtime_engine.engine.ScriptRunner.ScriptResult;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class PythonExecutor implements NodeExecutor {

    private final ScriptRunner scriptRunner;

    @Override
    public String supportedType() {
        return "Execute Python";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) throws InterruptedException {
        String code = NodeConfig.string(node, inputs, "code", "");
        Map<String, Object> outputs = new LinkedHashMap<>();
        if (code.isBlank()) {
            outputs.put("success", false);
            outputs.put("error", "No Python code provided");
            return NodeOutcome.next(outputs);
        }

        ScriptResult result = scriptRunner.runPython(code, arguments(node, inputs),
                run.getContext().getAssetsDir(), run.getCancellation());

        outputs.put("success", result.success());
        outputs.put("exitCode", result.exitCode());
        outputs.put("output", result.output());
        outputs.put("result", result.output());
        outputs.put("stderr", result.stderr());
        if (result.error() != null) {
            outputs.put("error", result.error());
        } else if (!result.success()) {
            outputs.put("error", result.stderr());
        }
        return NodeOutcome.next(outputs);
    }

    private static List<String> arguments(NodeDefinition node, Map<String, Object> inputs) {
        Object raw = NodeConfig.value(node, inputs, "args");
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (raw instanceof String text && !text.isBlank()) {
            return List.of(text.trim().split("\\s+"));
        }
        return List.of();
    }
}
