package com.runtimehub.runtime_engine.controller;

import com.runtimehub.runtime_engine.executor.NodeExecutorRegistry;
import com.runtimehub.runtime_engine.plugin.LoadedPlugin;
import com.runtimehub.runtime_engine.plugin.PluginLoader;
import com.runtimehub.runtime_engine.plugin.bundled.PluginLogStore;
import com.runtimehub.runtime_engine.port.PortMap;
import com.runtimehub.runtime_engine.port.PortRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class NodeTypeController {

    private final NodeExecutorRegistry executorRegistry;
    private final PortRegistry portRegistry;
    private final PluginLoader pluginLoader;

    // GET /api/node-types: every executable type with its ports
    @GetMapping("/node-types")
    public List<NodeTypeInfo> nodeTypes() {
        return executorRegistry.types().stream()
                .map(type -> {
                    PortMap ports = portRegistry.portsFor(type);
                    return ports != null
                            ? new NodeTypeInfo(type, ports.inputs(), ports.outputs())
                            : new NodeTypeInfo(type, List.of(), List.of());
                })
                .toList();
    }

    @GetMapping("/plugins")
    public List<LoadedPlugin> plugins() {
        return pluginLoader.getLoadedPlugins();
    }

    // GET /api/plugins/logs: entries recorded by Logger nodes
    @GetMapping("/plugins/logs")
    public List<PluginLogStore.Entry> pluginLogs(@RequestParam(required = false) String level,
                                                 @RequestParam(required = false) String workflowId,
                                                 @RequestParam(required = false) String nodeId,
                                                 @RequestParam(defaultValue = "100") int limit) {
        return PluginLogStore.shared().query(level, workflowId, nodeId, limit);
    }

    public record NodeTypeInfo(String type, List<String> inputs, List<String> outputs) {}
}
