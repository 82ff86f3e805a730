package com.runtimehub.runtime_engine.plugin;

import java.util.List;

/**
 * A plugin that passed validation, with the node types it actually registered and the ones
 * skipped because the type already existed.
 */
public record LoadedPlugin(
        String name,
        String version,
        String description,
        String source,
        List<String> nodeTypes,
        List<String> skippedTypes
) {}
