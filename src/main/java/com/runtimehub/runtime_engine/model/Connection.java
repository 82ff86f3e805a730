package com.runtimehub.runtime_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Directed edge between a positional output port and a positional input port.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Connection(String id, PortRef from, PortRef to) {

    public static Connection of(String id, String fromNodeId, int fromPort, String toNodeId, int toPort) {
        return new Connection(id, new PortRef(fromNodeId, fromPort), new PortRef(toNodeId, toPort));
    }

    public boolean leaves(String nodeId) {
        return from != null && nodeId.equals(from.nodeId());
    }

    public boolean enters(String nodeId) {
        return to != null && nodeId.equals(to.nodeId());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PortRef(String nodeId, int portIndex) {}
}
