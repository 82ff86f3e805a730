package com.runtimehub.runtime_engine.plugin;

import com.runtimehub.runtime_engine.executor.NodeExecutor;
import com.runtimehub.runtime_engine.port.PortMap;

/**
 * One node type contributed by a plugin. The type name is the executor's supported type.
 */
public record PluginNode(NodeExecutor executor, PortMap ports) {

    public String type() {
        return executor != null ? executor.supportedType() : null;
    }
}
