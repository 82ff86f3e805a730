package com.runtimehub.runtime_engine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Fluent builder for test graphs. */
public final class Graphs {

    private final List<NodeDefinition> nodes = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();

    public static Graphs graph() {
        return new Graphs();
    }

    public Graphs node(String id, String type) {
        return node(id, type, Map.of());
    }

    public Graphs node(String id, String type, Map<String, Object> config) {
        nodes.add(NodeDefinition.of(id, type, config));
        return this;
    }

    public Graphs connect(String from, String to) {
        return connect(from, 0, to, 0);
    }

    public Graphs connect(String from, int fromPort, String to, int toPort) {
        connections.add(Connection.of("c" + (connections.size() + 1), from, fromPort, to, toPort));
        return this;
    }

    public List<NodeDefinition> nodes() {
        return List.copyOf(nodes);
    }

    public List<Connection> connections() {
        return List.copyOf(connections);
    }
}
