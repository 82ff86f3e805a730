package com.runtimehub.runtime_engine.port;

import java.util.List;

/**
 * Positional port names of a node type. Connections reference ports by index; this maps
 * the index back to a semantic name.
 */
public record PortMap(List<String> inputs, List<String> outputs) {

    public PortMap {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public static PortMap of(List<String> inputs, List<String> outputs) {
        return new PortMap(inputs, outputs);
    }

    public String inputName(int index) {
        return index >= 0 && index < inputs.size() ? inputs.get(index) : "input_" + index;
    }

    public String outputName(int index) {
        return index >= 0 && index < outputs.size() ? outputs.get(index) : "output_" + index;
    }
}
