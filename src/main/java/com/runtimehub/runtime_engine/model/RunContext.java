package com.runtimehub.runtime_engine.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run data: node results keyed by node id, free-form variables, and the scratch directory.
 */
public class RunContext {

    private final Map<String, Map<String, Object>> values = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Object> variables = Collections.synchronizedMap(new LinkedHashMap<>());
    private volatile Path assetsDir;

    public void putValue(String nodeId, Map<String, Object> result) {
        values.put(nodeId, result);
    }

    public boolean hasValue(String nodeId) {
        return values.containsKey(nodeId);
    }

    public Map<String, Object> getValue(String nodeId) {
        return values.get(nodeId);
    }

    /** Snapshot in insertion order. */
    public Map<String, Map<String, Object>> getValues() {
        synchronized (values) {
            return new LinkedHashMap<>(values);
        }
    }

    public void setVariable(String key, Object value) {
        variables.put(key, value);
    }

    public Object getVariable(String key) {
        return variables.get(key);
    }

    public Map<String, Object> getVariables() {
        synchronized (variables) {
            return new LinkedHashMap<>(variables);
        }
    }

    @JsonSerialize(using = ToStringSerializer.class)
    public Path getAssetsDir() {
        return assetsDir;
    }

    public void setAssetsDir(Path assetsDir) {
        this.assetsDir = assetsDir;
    }
}
