package com.runtimehub.runtime_engine.plugin;

import java.util.List;

/**
 * SPI for node-type plugins. Implementations are discovered with {@link java.util.ServiceLoader}
 * (META-INF/services/com.runtimehub.runtime_engine.plugin.NodePlugin), either on the application
 * class path or in a jar dropped into the plugins directory. They need a public no-arg constructor.
 */
public interface NodePlugin {

    /** Display name, e.g. "Example Plugin". Must not be blank. */
    String getName();

    /** Plugin version, e.g. "1.0.0". Must not be blank. */
    String getVersion();

    default String getDescription() {
        return "";
    }

    /** Node types contributed by this plugin. */
    List<PluginNode> getNodes();
}
