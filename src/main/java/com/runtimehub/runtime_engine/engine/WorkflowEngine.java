package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.config.RuntimeHubProperties;
import com.runtimehub.runtime_engine.engine.exception.CapacityException;
import com.runtimehub.runtime_engine.engine.exception.ValidationException;
import com.runtimehub.runtime_engine.engine.exception.WorkflowCancelledException;
import com.runtimehub.runtime_engine.engine.exception.WorkflowTimeoutException;
import com.runtimehub.runtime_engine.executor.NodeExecutorRegistry;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.HistoryEntry;
import com.runtimehub.runtime_engine.model.MetricsSnapshot;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import com.runtimehub.runtime_engine.model.WorkflowStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Admits, runs, times out, stops and finalizes workflow runs.
 *
 * <p>Admission is serialized on this instance so two submissions can never both pass the
 * capacity check. Each admitted run is traversed by one worker thread; its future completes
 * with the run once it reaches a terminal status, which happens exactly once.
 */
@Slf4j
@Service
public class WorkflowEngine {

    static final String TIMEOUT_MESSAGE = "Workflow execution timeout";
    static final String STOPPED_MESSAGE = "Workflow stopped";

    /** Deep graphs recurse once per visited node. */
    private static final long WORKER_STACK_SIZE = 16L * 1024 * 1024;

    private final GraphExecutor graphExecutor;
    private final NodeExecutorRegistry executorRegistry;
    private final RunWorkspaceManager workspaceManager;
    private final WorkflowMetrics metrics;
    private final WorkflowHistory history;
    private final ExecutionEventPublisher eventPublisher;
    private final RuntimeHubProperties.Workflow settings;

    private final ExecutorService workerPool = Executors.newCachedThreadPool(workerThreadFactory());
    private final ScheduledExecutorService timeoutScheduler =
            Executors.newSingleThreadScheduledExecutor(daemonThreadFactory("runtime-hub-timeout-"));

    // guarded by this
    private final Map<String, ActiveRun> running = new LinkedHashMap<>();
    private final Deque<ActiveRun> queue = new ArrayDeque<>();

    public WorkflowEngine(GraphExecutor graphExecutor,
                          NodeExecutorRegistry executorRegistry,
                          RunWorkspaceManager workspaceManager,
                          WorkflowMetrics metrics,
                          WorkflowHistory history,
                          ExecutionEventPublisher eventPublisher,
                          RuntimeHubProperties properties) {
        this.graphExecutor = graphExecutor;
        this.executorRegistry = executorRegistry;
        this.workspaceManager = workspaceManager;
        this.metrics = metrics;
        this.history = history;
        this.eventPublisher = eventPublisher;
        this.settings = properties.getWorkflow();
    }

    /**
     * Admits a run and starts it asynchronously, or queues it when the engine is full and
     * queueing is enabled.
     *
     * @throws CapacityException   when the engine is full and queueing is disabled
     * @throws ValidationException when the workflow or a node id is blank or repeated, the graph has
     *                             no single Start node, or the id is already active
     */
    public CompletableFuture<WorkflowRun> executeWorkflow(String workflowId,
                                                          List<NodeDefinition> nodes,
                                                          List<Connection> connections) {
        validateIds(workflowId, nodes);
        ActiveRun active = new ActiveRun(new WorkflowRun(workflowId, nodes, connections));
        boolean queued;
        synchronized (this) {
            boolean full = running.size() >= settings.getMaxConcurrentWorkflows();
            if (full && !settings.isQueueEnabled()) {
                throw new CapacityException(settings.getMaxConcurrentWorkflows());
            }
            if (active.run.startNodes().size() != 1) {
                throw new ValidationException("Workflow must have exactly one Start node");
            }
            if (running.containsKey(workflowId) || findQueued(workflowId).isPresent()) {
                throw new ValidationException("Workflow " + workflowId + " is already running");
            }
            queued = full;
            if (queued) {
                queue.addLast(active);
            } else {
                running.put(workflowId, active);
            }
        }

        if (queued) {
            log.info("Workflow {} queued, {} waiting", workflowId, queueSize());
            eventPublisher.workflowUpdate(active.run, "queued");
        } else {
            startWorkflow(active);
        }
        return active.future;
    }

    private static void validateIds(String workflowId, List<NodeDefinition> nodes) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new ValidationException("Workflow id is required");
        }
        Set<String> seen = new HashSet<>();
        for (NodeDefinition node : nodes != null ? nodes : List.<NodeDefinition>of()) {
            if (node == null || node.id() == null || node.id().isBlank()) {
                throw new ValidationException("Every node needs an id");
            }
            if (!seen.add(node.id())) {
                throw new ValidationException("Duplicate node id: " + node.id());
            }
        }
    }

    private void startWorkflow(ActiveRun active) {
        WorkflowRun run = active.run;
        try {
            run.getContext().setAssetsDir(workspaceManager.create(run.getId()));
        } catch (UncheckedIOException e) {
            log.warn("Workflow {} runs without a workspace: {}", run.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Workflow {} could not be prepared: {}", run.getId(), GraphExecutor.messageOf(e));
            finish(active, WorkflowStatus.ERROR, GraphExecutor.messageOf(e));
            return;
        }
        if (!run.markRunning()) {
            return;
        }
        log.info("Starting workflow {} ({} nodes, {} connections)",
                run.getId(), run.getNodes().size(), run.getConnections().size());
        eventPublisher.workflowUpdate(run, WorkflowStatus.RUNNING.value());

        active.timeout = timeoutScheduler.schedule(() -> onTimeout(active),
                settings.getDefaultTimeout().toMillis(), TimeUnit.MILLISECONDS);
        try {
            workerPool.execute(() -> runWorker(active));
        } catch (RejectedExecutionException e) {
            finish(active, WorkflowStatus.ERROR, "Engine is shutting down");
        }
    }

    private void runWorker(ActiveRun active) {
        WorkflowRun run = active.run;
        active.attachWorker(Thread.currentThread());
        try {
            List<String> unknown = run.getNodes().stream()
                    .map(NodeDefinition::type)
                    .filter(type -> !executorRegistry.has(type))
                    .distinct()
                    .toList();
            if (!unknown.isEmpty()) {
                throw new ValidationException("Unknown node type(s): " + String.join(", ", unknown));
            }
            graphExecutor.execute(run);
            finish(active, WorkflowStatus.COMPLETED, null);
        } catch (WorkflowTimeoutException e) {
            finish(active, WorkflowStatus.ERROR, TIMEOUT_MESSAGE);
        } catch (WorkflowCancelledException e) {
            // Stop and timeout have normally finalized the run already
            finish(active, WorkflowStatus.STOPPED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Workflow {} failed: {}", run.getId(), GraphExecutor.messageOf(e));
            finish(active, WorkflowStatus.ERROR, GraphExecutor.messageOf(e));
        } catch (StackOverflowError e) {
            log.error("Workflow {} exceeded the maximum graph depth", run.getId());
            finish(active, WorkflowStatus.ERROR, "Workflow graph too deep");
        } finally {
            active.detachWorker();
        }
    }

    private void onTimeout(ActiveRun active) {
        WorkflowRun run = active.run;
        if (!run.finish(WorkflowStatus.ERROR, TIMEOUT_MESSAGE)) {
            return;
        }
        log.warn("Workflow {} timed out after {}", run.getId(), settings.getDefaultTimeout());
        run.getCancellation().expire(TIMEOUT_MESSAGE);
        active.interruptWorker();
        complete(active);
    }

    /**
     * Stops a running or queued run. Executors already in flight finish on their own;
     * their results are discarded.
     *
     * @return false when no active run has that id
     */
    public boolean stopWorkflow(String workflowId) {
        ActiveRun active;
        synchronized (this) {
            active = running.get(workflowId);
            if (active == null) {
                active = findQueued(workflowId).orElse(null);
            }
        }
        if (active == null || !active.run.finish(WorkflowStatus.STOPPED, null)) {
            return false;
        }
        active.run.getCancellation().cancel(STOPPED_MESSAGE);
        log.info("Workflow {} stopped", workflowId);
        complete(active);
        return true;
    }

    private boolean finish(ActiveRun active, WorkflowStatus status, String error) {
        if (!active.run.finish(status, error)) {
            return false;
        }
        complete(active);
        return true;
    }

    /** Bookkeeping after the run's terminal transition; runs once per run. */
    private void complete(ActiveRun active) {
        WorkflowRun run = active.run;
        ScheduledFuture<?> timeout = active.timeout;
        if (timeout != null) {
            timeout.cancel(false);
        }
        synchronized (this) {
            running.remove(run.getId(), active);
            queue.remove(active);
        }
        metrics.record(run);
        history.append(run);
        eventPublisher.workflowUpdate(run, run.getStatus().value());
        log.info("Workflow {} finished: {} in {}ms{}", run.getId(), run.getStatus().value(), run.getDuration(),
                run.getError() != null ? " (" + run.getError() + ")" : "");
        active.future.complete(run);
        processQueue();
    }

    /** Starts queued runs in FIFO order while capacity remains. */
    void processQueue() {
        List<ActiveRun> ready = new ArrayList<>();
        synchronized (this) {
            while (!queue.isEmpty() && running.size() < settings.getMaxConcurrentWorkflows()) {
                ActiveRun next = queue.pollFirst();
                running.put(next.run.getId(), next);
                ready.add(next);
            }
        }
        ready.forEach(this::startWorkflow);
    }

    public synchronized Optional<WorkflowRun> getStatus(String workflowId) {
        ActiveRun active = running.get(workflowId);
        if (active != null) {
            return Optional.of(active.run);
        }
        return findQueued(workflowId).map(a -> a.run);
    }

    public synchronized List<WorkflowRun> getRunningWorkflows() {
        return running.values().stream().map(a -> a.run).toList();
    }

    public synchronized List<WorkflowRun> getQueuedWorkflows() {
        return queue.stream().map(a -> a.run).toList();
    }

    public MetricsSnapshot getMetrics() {
        int runningCount;
        int queuedCount;
        synchronized (this) {
            runningCount = running.size();
            queuedCount = queue.size();
        }
        return metrics.snapshot(runningCount, queuedCount, settings.getMaxConcurrentWorkflows());
    }

    public List<HistoryEntry> getHistory(int limit) {
        return history.recent(limit);
    }

    public Optional<HistoryEntry> getLatestHistory(String workflowId) {
        return history.latest(workflowId);
    }

    private synchronized int queueSize() {
        return queue.size();
    }

    private Optional<ActiveRun> findQueued(String workflowId) {
        return queue.stream().filter(a -> a.run.getId().equals(workflowId)).findFirst();
    }

    @PreDestroy
    public void shutdown() {
        timeoutScheduler.shutdownNow();
        workerPool.shutdownNow();
    }

    private static ThreadFactory workerThreadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("runtime-hub-worker-") {
            @Override
            public Thread createThread(Runnable runnable) {
                Thread thread = new Thread(getThreadGroup(), runnable, nextThreadName(), WORKER_STACK_SIZE);
                thread.setPriority(getThreadPriority());
                thread.setDaemon(isDaemon());
                return thread;
            }
        };
        factory.setDaemon(true);
        return factory;
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    private static final class ActiveRun {
        private final WorkflowRun run;
        private final CompletableFuture<WorkflowRun> future = new CompletableFuture<>();
        private volatile ScheduledFuture<?> timeout;
        private Thread worker;

        private ActiveRun(WorkflowRun run) {
            this.run = run;
        }

        synchronized void attachWorker(Thread thread) {
            worker = thread;
        }

        synchronized void detachWorker() {
            worker = null;
            // an interrupt aimed at this run must not leak into the next task on the pooled thread
            Thread.interrupted();
        }

        synchronized void interruptWorker() {
            if (worker != null) {
                worker.interrupt();
            }
        }
    }
}
