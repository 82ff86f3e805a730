package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;

import java.util.List;
import java.util.Map;

public interface NodeExecutor {

    /** Node type this executor handles, as written in {@link NodeDefinition#type()}. */
    String supportedType();

    /**
     * Runs one node. Any exception is treated as a node failure and goes through the
     * node's onError policy.
     */
    NodeOutcome execute(NodeDefinition node,
                        WorkflowRun run,
                        List<Connection> connections,
                        Map<String, Object> inputs) throws Exception;
}
