package com.runtimehub.runtime_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.runtimehub.runtime_engine.engine.CancellationToken;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One execution of a submitted graph. Owned by the engine from admission until it is
 * finalized; serialized as-is for the REST and event surfaces.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowRun {

    private final String id;
    private final List<NodeDefinition> nodes;
    private final List<Connection> connections;
    private final long submittedAt = System.currentTimeMillis();

    private volatile WorkflowStatus status = WorkflowStatus.PENDING;
    private volatile Long startTime;
    private volatile Long endTime;
    private volatile Long duration;
    private volatile String error;

    private final Map<String, NodeState> executionState = new ConcurrentHashMap<>();
    private final RunContext context = new RunContext();

    @JsonIgnore
    private final Map<String, NodeDefinition> nodeIndex;
    @JsonIgnore
    private final CancellationToken cancellation = new CancellationToken();
    @JsonIgnore
    private final Set<String> completedNodeIds = ConcurrentHashMap.newKeySet();
    @JsonIgnore
    private final AtomicInteger nodeExecutions = new AtomicInteger();
    @JsonIgnore
    private volatile NodeTraverser traverser;

    public WorkflowRun(String id, List<NodeDefinition> nodes, List<Connection> connections) {
        this.id = id;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.connections = connections != null ? List.copyOf(connections) : List.of();
        this.nodeIndex = this.nodes.stream()
                .collect(Collectors.toMap(NodeDefinition::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public int getCompletedNodeCount() {
        return completedNodeIds.size();
    }

    public Optional<NodeDefinition> findNode(String nodeId) {
        return Optional.ofNullable(nodeIndex.get(nodeId));
    }

    public List<NodeDefinition> startNodes() {
        return nodes.stream().filter(n -> "Start".equals(n.type())).toList();
    }

    public NodeState stateOf(String nodeId) {
        return executionState.computeIfAbsent(nodeId, k -> new NodeState());
    }

    /** Stores a node result; values from an earlier visit of the same node are overwritten. */
    public void recordResult(String nodeId, Map<String, Object> outputs) {
        context.putValue(nodeId, outputs);
        completedNodeIds.add(nodeId);
    }

    public int incrementNodeExecutions() {
        return nodeExecutions.incrementAndGet();
    }

    public void attachTraverser(NodeTraverser traverser) {
        this.traverser = traverser;
    }

    /** Continues the graph from {@code node}; used by executors that manage their own traversal. */
    public void traverse(NodeDefinition node) {
        if (traverser == null) {
            throw new IllegalStateException("Run " + id + " is not executing");
        }
        traverser.traverse(this, node);
    }

    /** Pending to running; false when the run was stopped before it could start. */
    public synchronized boolean markRunning() {
        if (status != WorkflowStatus.PENDING) {
            return false;
        }
        status = WorkflowStatus.RUNNING;
        startTime = System.currentTimeMillis();
        return true;
    }

    /**
     * Moves the run into a terminal status. Only the first call wins; later calls
     * (a timeout racing a stop, for instance) return false and change nothing.
     */
    public synchronized boolean finish(WorkflowStatus terminal, String errorMessage) {
        if (status.isTerminal()) {
            return false;
        }
        status = terminal;
        error = errorMessage;
        endTime = System.currentTimeMillis();
        duration = endTime - (startTime != null ? startTime : submittedAt);
        return true;
    }
}
