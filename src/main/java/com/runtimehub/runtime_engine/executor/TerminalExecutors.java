package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
abstract class TerminalExecutor implements NodeExecutor {

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        log.debug("{} node {} reached in run {}", supportedType(), node.id(), run.getId());
        return NodeOutcome.next(Map.of("message", message()));
    }

    protected abstract String message();
}

@Component
class StartExecutor extends TerminalExecutor {

    @Override public String supportedType() { return "Start"; }
    @Override protected String message() { return "Workflow execution started"; }
}

@Component
class EndExecutor extends TerminalExecutor {

    @Override public String supportedType() { return "End"; }
    @Override protected String message() { return "Workflow execution completed"; }
}
