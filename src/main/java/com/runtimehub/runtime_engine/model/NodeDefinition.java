package com.runtimehub.runtime_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node as submitted by the editor. Position and the inputs/outputs arrays are UI metadata;
 * the engine derives port semantics from the PortRegistry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeDefinition(
        String id,
        String type,
        String label,
        Double x,
        Double y,
        List<Object> inputs,
        List<Object> outputs,
        Map<String, Object> config
) {

    public NodeDefinition {
        config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Map.of();
    }

    public static NodeDefinition of(String id, String type) {
        return of(id, type, Map.of());
    }

    public static NodeDefinition of(String id, String type, Map<String, Object> config) {
        return new NodeDefinition(id, type, null, 0.0, 0.0, null, null, config);
    }
}
