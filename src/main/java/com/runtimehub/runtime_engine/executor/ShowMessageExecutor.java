package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.engine.ExecutionEventPublisher;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ShowMessageExecutor implements NodeExecutor {

    private final ExecutionEventPublisher eventPublisher;

    @Override
    public String supportedType() {
        return "Show Message";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        String title = NodeConfig.string(node, inputs, "title", "Notification");
        String message = NodeConfig.string(node, inputs, "message", "");
        String type = NodeConfig.string(node, "type", "info");

        eventPublisher.notification(title, message, type);
        return NodeOutcome.next(Map.of("title", title, "message", message, "shown", true));
    }
}
