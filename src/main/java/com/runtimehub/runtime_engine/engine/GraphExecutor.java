package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.config.RuntimeHubProperties;
import com.runtimehub.runtime_engine.engine.exception.NodeExecutionException;
import com.runtimehub.runtime_engine.engine.exception.ValidationException;
import com.runtimehub.runtime_engine.engine.exception.WorkflowCancelledException;
import com.runtimehub.runtime_engine.engine.exception.WorkflowException;
import com.runtimehub.runtime_engine.engine.exception.WorkflowTimeoutException;
import com.runtimehub.runtime_engine.executor.NodeConfig;
import com.runtimehub.runtime_engine.executor.NodeExecutor;
import com.runtimehub.runtime_engine.executor.NodeExecutorRegistry;
import com.runtimehub.runtime_engine.executor.NodeOutcome;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.NodeState;
import com.runtimehub.runtime_engine.model.NodeStatus;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import com.runtimehub.runtime_engine.port.PortMap;
import com.runtimehub.runtime_engine.port.PortRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Walks a run's graph depth-first from a node: resolves inputs, dispatches to the executor,
 * applies the node's onError policy and continues along the outgoing connections.
 */
@Slf4j
@Component
public class GraphExecutor {

    private static final String SOURCE = "WorkflowEngine";

    private final NodeExecutorRegistry executorRegistry;
    private final InputResolver inputResolver;
    private final PortRegistry portRegistry;
    private final ExecutionEventPublisher eventPublisher;
    private final RuntimeHubProperties.Workflow settings;
    private final ExecutorService branchPool =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("runtime-hub-branch-"));

    public GraphExecutor(NodeExecutorRegistry executorRegistry,
                         InputResolver inputResolver,
                         PortRegistry portRegistry,
                         ExecutionEventPublisher eventPublisher,
                         RuntimeHubProperties properties) {
        this.executorRegistry = executorRegistry;
        this.inputResolver = inputResolver;
        this.portRegistry = portRegistry;
        this.eventPublisher = eventPublisher;
        this.settings = properties.getWorkflow();
    }

    /** Runs the whole graph from its Start node on the calling thread. */
    public void execute(WorkflowRun run) {
        NodeDefinition start = run.startNodes().stream()
                .findFirst()
                .orElseThrow(() -> new ValidationException("Workflow must have exactly one Start node"));
        run.attachTraverser((r, node) -> executeNode(r, node, r.getConnections()));
        executeNode(run, start, run.getConnections());
    }

    public void executeNode(WorkflowRun run, NodeDefinition node, List<Connection> connections) {
        executeNode(run, node, connections, false);
    }

    /** A retry keeps the node's retry count; any other visit, such as a loop iteration, starts a fresh budget. */
    private void executeNode(WorkflowRun run, NodeDefinition node, List<Connection> connections, boolean retry) {
        run.getCancellation().throwIfCancelled();

        int executions = run.incrementNodeExecutions();
        if (executions > settings.getMaxNodeExecutions()) {
            throw new WorkflowException("Maximum node executions (" + settings.getMaxNodeExecutions()
                    + ") exceeded, possible loop in workflow");
        }

        NodeState state = run.stateOf(node.id());
        if (!retry) {
            state.resetRetryCount();
        }
        state.markRunning();
        debug("Executing node {} ({}) in run {}", node.type(), node.id(), run.getId());
        eventPublisher.nodeUpdate(run.getId(), node.id(), NodeStatus.RUNNING, null);
        eventPublisher.logEntry(SOURCE, "info", "Executing node: " + node.type(),
                Map.of("nodeId", node.id(), "workflowId", run.getId()));

        Map<String, Object> inputs = inputResolver.resolveInputs(node, run, connections);

        Optional<NodeExecutor> executor = executorRegistry.find(node.type());
        if (executor.isEmpty()) {
            String message = "No executor found for node type: " + node.type();
            state.markFailed(message);
            eventPublisher.nodeUpdate(run.getId(), node.id(), NodeStatus.ERROR, Map.of("error", message));
            throw new ValidationException(message);
        }

        NodeOutcome outcome;
        try {
            outcome = executor.get().execute(node, run, connections, inputs);
        } catch (WorkflowException e) {
            // Raised by the engine itself (cancellation, or a downstream node traversed by this executor)
            state.markFailed(messageOf(e));
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.markFailed("Interrupted");
            throw new WorkflowCancelledException(cancelReason(run, "Node " + node.id() + " interrupted"));
        } catch (Exception e) {
            if (run.isCancelled()) {
                state.markFailed(messageOf(e));
                throw new WorkflowCancelledException(cancelReason(run, messageOf(e)));
            }
            handleFailure(run, node, connections, state, e);
            return;
        }

        if (run.isCancelled()) {
            state.markFailed("Cancelled");
            throw new WorkflowCancelledException(cancelReason(run, "Workflow cancelled"));
        }

        Map<String, Object> outputs = outcome.outputs();
        state.markCompleted(outputs);
        run.recordResult(node.id(), outputs);
        debug("Node {} ({}) completed in {}ms", node.type(), node.id(), state.getDuration());
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("nodeId", node.id());
        logData.put("duration", state.getDuration());
        eventPublisher.logEntry(SOURCE, "success",
                "Node completed: " + node.type() + " (" + state.getDuration() + "ms)", logData);
        eventPublisher.nodeUpdate(run.getId(), node.id(), NodeStatus.COMPLETED, outputs);

        if (!(outcome instanceof NodeOutcome.Handled)) {
            executeConnectedNodes(run, node, connections, outcome);
        }
    }

    public void executeConnectedNodes(WorkflowRun run, NodeDefinition node, List<Connection> connections,
                                      NodeOutcome outcome) {
        List<Connection> outgoing = connections.stream()
                .filter(c -> c.leaves(node.id()))
                .toList();

        if (outcome instanceof NodeOutcome.Branch branch) {
            PortMap ports = portRegistry.portsFor(node.type());
            if (ports != null) {
                outgoing = outgoing.stream()
                        .filter(c -> branch.port().equals(ports.outputName(c.from().portIndex())))
                        .toList();
            }
        }

        List<NodeDefinition> targets = new ArrayList<>();
        for (Connection connection : outgoing) {
            Optional<NodeDefinition> target = run.findNode(connection.to().nodeId());
            if (target.isPresent()) {
                targets.add(target.get());
            } else {
                log.warn("Connection {} points at unknown node {}", connection.id(), connection.to().nodeId());
            }
        }

        if (targets.size() > 1 && NodeConfig.flag(node, "parallelBranches")) {
            executeInParallel(run, targets, connections);
            return;
        }
        for (NodeDefinition target : targets) {
            executeNode(run, target, connections);
        }
    }

    private void executeInParallel(WorkflowRun run, List<NodeDefinition> targets, List<Connection> connections) {
        List<CompletableFuture<Void>> branches = targets.stream()
                .map(target -> CompletableFuture.runAsync(() -> executeNode(run, target, connections), branchPool))
                .toList();

        RuntimeException first = null;
        for (CompletableFuture<Void> branch : branches) {
            try {
                branch.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                branches.forEach(b -> b.cancel(true));
                String reason = cancelReason(run, "Interrupted while waiting for parallel branches");
                throw run.getCancellation().isExpired()
                        ? new WorkflowTimeoutException(reason)
                        : new WorkflowCancelledException(reason);
            } catch (ExecutionException e) {
                if (first == null) {
                    first = e.getCause() instanceof RuntimeException re
                            ? re
                            : new WorkflowException(messageOf(e.getCause()), e.getCause());
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private void handleFailure(WorkflowRun run, NodeDefinition node, List<Connection> connections,
                               NodeState state, Exception error) {
        String message = messageOf(error);
        state.markFailed(message);

        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("nodeId", node.id());
        logData.put("error", message);
        logData.put("duration", state.getDuration());
        eventPublisher.logEntry(SOURCE, "error", "Node failed: " + node.type() + " - " + message, logData);
        eventPublisher.nodeUpdate(run.getId(), node.id(), NodeStatus.ERROR, Map.of("error", message));

        String policy = NodeConfig.string(node, "onError", "stop");
        switch (policy) {
            case "skip" -> log.warn("Node {} ({}) failed, skipping: {}", node.type(), node.id(), message);
            case "retry" -> {
                long maxRetries = NodeConfig.number(node, "maxRetries", 3);
                if (state.getRetryCount() >= maxRetries) {
                    throw new NodeExecutionException(node.id(), node.type(),
                            "Node " + node.id() + " failed after " + maxRetries + " retries: " + message, error);
                }
                int attempt = state.incrementRetryCount();
                long backoff = settings.getRetryBackoff().toMillis() * attempt;
                log.warn("Retrying node {} ({}) attempt {}/{} in {}ms: {}",
                        node.type(), node.id(), attempt, maxRetries, backoff, message);
                run.getCancellation().sleep(backoff);
                executeNode(run, node, connections, true);
            }
            default -> {
                log.error("Node {} ({}) failed: {}", node.type(), node.id(), message);
                throw new NodeExecutionException(node.id(), node.type(), message, error);
            }
        }
    }

    private void debug(String format, Object... args) {
        if (settings.isEnableDebugLogging()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static String cancelReason(WorkflowRun run, String fallback) {
        String reason = run.getCancellation().getReason();
        return reason != null ? reason : fallback;
    }

    static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    @PreDestroy
    public void shutdown() {
        branchPool.shutdownNow();
    }
}
