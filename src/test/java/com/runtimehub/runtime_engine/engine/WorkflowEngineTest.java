package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.engine.exception.CapacityException;
import com.runtimehub.runtime_engine.engine.exception.ValidationException;
import com.runtimehub.runtime_engine.engine.exception.WorkflowCancelledException;
import com.runtimehub.runtime_engine.model.Graphs;
import com.runtimehub.runtime_engine.model.HistoryEntry;
import com.runtimehub.runtime_engine.model.MetricsSnapshot;
import com.runtimehub.runtime_engine.model.NodeStatus;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import com.runtimehub.runtime_engine.model.WorkflowStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

import static com.runtimehub.runtime_engine.model.Graphs.graph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class WorkflowEngineTest {

    @TempDir
    Path workspace;

    private EngineFixture fixture;
    private TestExecutors.Recording recorder;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(workspace);
        recorder = new TestExecutors.Recording("Record");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private WorkflowRun run(String id, Graphs graph) throws Exception {
        return fixture.engine.executeWorkflow(id, graph.nodes(), graph.connections()).get(10, TimeUnit.SECONDS);
    }

    @Nested
    class Traversal {

        @Test
        void shouldRunLinearChainInOrder() throws Exception {
            fixture.start(recorder);

            WorkflowRun run = run("linear", graph()
                    .node("start", "Start")
                    .node("a", "Record")
                    .node("b", "Record")
                    .node("end", "End")
                    .connect("start", "a")
                    .connect("a", "b")
                    .connect("b", "end"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(run.getError()).isNull();
            assertThat(recorder.visits).containsExactly("a", "b");
            assertThat(run.getCompletedNodeCount()).isEqualTo(4);
            assertThat(run.getExecutionState().get("end").getStatus()).isEqualTo(NodeStatus.COMPLETED);
            assertThat(run.getDuration()).isNotNull().isGreaterThanOrEqualTo(0L);
        }

        @Test
        void shouldPassUpstreamResultAsInput() throws Exception {
            fixture.start(recorder);

            run("inputs", graph()
                    .node("start", "Start")
                    .node("a", "Record", Map.of("output", Map.of("answer", 42)))
                    .node("b", "Record")
                    .connect("start", "a")
                    .connect("a", "b"));

            assertThat(recorder.inputs.get("a")).isEmpty();
            assertThat(recorder.inputs.get("b")).containsEntry("input_0", Map.of("answer", 42));
        }

        @Test
        void shouldCompleteStartOnlyGraph() throws Exception {
            fixture.start();

            WorkflowRun run = run("solo", graph().node("start", "Start"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(run.getContext().getValue("start")).containsKey("message");
        }

        @Test
        void shouldFollowOnlyTheTakenConditionBranch() throws Exception {
            fixture.start(recorder);

            WorkflowRun run = run("branch", graph()
                    .node("start", "Start")
                    .node("check", "Condition", Map.of("condition", "a", "operator", "equals", "value", "b"))
                    .node("yes", "Record")
                    .node("no", "Record")
                    .connect("start", "check")
                    .connect("check", 0, "yes", 0)
                    .connect("check", 1, "no", 0));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(recorder.visits).containsExactly("no");
            assertThat(run.getContext().getValue("check")).containsEntry("branch", "false");
        }

        @Test
        void shouldRunLoopBodyOncePerIterationThenExit() throws Exception {
            fixture.start(recorder);

            WorkflowRun run = run("loop", graph()
                    .node("start", "Start")
                    .node("loop", "Loop", Map.of("iterations", 3))
                    .node("body", "Record")
                    .node("after", "Record")
                    .connect("start", "loop")
                    .connect("loop", 0, "body", 0)
                    .connect("loop", 1, "after", 0));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(recorder.visits).containsExactly("body", "body", "body", "after");
            assertThat(run.getExecutionState().get("body").getAttempts()).isEqualTo(3);
            assertThat(run.getContext().getValue("loop")).containsEntry("completed", 3);
            assertThat(run.getContext().getVariable("loop.iteration")).isEqualTo(3);
        }

        @Test
        void shouldRunParallelBranchesOnSeparateThreads() throws Exception {
            fixture.start(recorder);

            WorkflowRun run = run("fanout", graph()
                    .node("start", "Start", Map.of("parallelBranches", true))
                    .node("left", "Record", Map.of("sleepMillis", 100))
                    .node("right", "Record", Map.of("sleepMillis", 100))
                    .connect("start", "left")
                    .connect("start", "right"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(recorder.visits).containsExactlyInAnyOrder("left", "right");
            assertThat(recorder.threads.get("left")).isNotEqualTo(recorder.threads.get("right"));
        }

        @Test
        void shouldWaitForDelayNode() throws Exception {
            fixture.start();

            WorkflowRun run = run("delay", graph()
                    .node("start", "Start")
                    .node("pause", "Delay", Map.of("duration", 500, "unit", "ms"))
                    .connect("start", "pause"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(run.getDuration()).isGreaterThanOrEqualTo(500L);
            assertThat(run.getExecutionState().get("pause").getDuration()).isGreaterThanOrEqualTo(500L);
        }

        @Test
        void shouldFailCyclicGraphAtExecutionLimit() throws Exception {
            fixture.workflow().setMaxNodeExecutions(20);
            fixture.start(recorder);

            WorkflowRun run = run("cycle", graph()
                    .node("start", "Start")
                    .node("a", "Record")
                    .node("b", "Record")
                    .connect("start", "a")
                    .connect("a", "b")
                    .connect("b", "a"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.ERROR);
            assertThat(run.getError()).contains("Maximum node executions (20)").contains("possible loop");
            assertThat(run.getNodeExecutions().get()).isEqualTo(21);
        }
    }

    @Nested
    class ErrorPolicies {

        @Test
        void shouldStopRunOnFailureByDefault() throws Exception {
            TestExecutors.Flaky flaky = new TestExecutors.Flaky(Integer.MAX_VALUE);
            fixture.start(flaky, recorder);

            WorkflowRun run = run("stop-policy", graph()
                    .node("start", "Start")
                    .node("bad", "Flaky")
                    .node("after", "Record")
                    .connect("start", "bad")
                    .connect("bad", "after"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.ERROR);
            assertThat(run.getError()).isEqualTo("flaky failure 1");
            assertThat(recorder.visits).isEmpty();
            assertThat(run.getExecutionState().get("bad").getStatus()).isEqualTo(NodeStatus.ERROR);
        }

        @Test
        void shouldRetryUntilNodeSucceeds() throws Exception {
            TestExecutors.Flaky flaky = new TestExecutors.Flaky(2);
            fixture.start(flaky, recorder);

            WorkflowRun run = run("retry", graph()
                    .node("start", "Start")
                    .node("flaky", "Flaky", Map.of("onError", "retry", "maxRetries", 3))
                    .node("after", "Record")
                    .connect("start", "flaky")
                    .connect("flaky", "after"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(run.getExecutionState().get("flaky").getRetryCount()).isEqualTo(2);
            assertThat(run.getExecutionState().get("flaky").getAttempts()).isEqualTo(3);
            assertThat(recorder.visits).containsExactly("after");
        }

        @Test
        void shouldGiveEachLoopIterationItsOwnRetryBudget() throws Exception {
            TestExecutors.Alternating alternating = new TestExecutors.Alternating();
            fixture.start(alternating);

            WorkflowRun run = run("loop-retry", graph()
                    .node("start", "Start")
                    .node("loop", "Loop", Map.of("iterations", 3))
                    .node("body", "Alternating", Map.of("onError", "retry", "maxRetries", 1))
                    .connect("start", "loop")
                    .connect("loop", 0, "body", 0));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(alternating.calls).hasValue(6);
            assertThat(run.getExecutionState().get("body").getRetryCount()).isEqualTo(1);
        }

        @Test
        void shouldFailAfterRetriesAreExhausted() throws Exception {
            fixture.start(new TestExecutors.Flaky(Integer.MAX_VALUE));

            WorkflowRun run = run("retry-exhausted", graph()
                    .node("start", "Start")
                    .node("flaky", "Flaky", Map.of("onError", "retry", "maxRetries", 2))
                    .connect("start", "flaky"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.ERROR);
            assertThat(run.getError()).isEqualTo("Node flaky failed after 2 retries: flaky failure 3");
        }

        @Test
        void shouldSkipFailedNodeAndKeepSiblingsRunning() throws Exception {
            fixture.start(new TestExecutors.Flaky(Integer.MAX_VALUE), recorder);

            WorkflowRun run = run("skip", graph()
                    .node("start", "Start")
                    .node("bad", "Flaky", Map.of("onError", "skip"))
                    .node("downstream", "Record")
                    .node("sibling", "Record")
                    .connect("start", "bad")
                    .connect("bad", "downstream")
                    .connect("start", "sibling"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(recorder.visits).containsExactly("sibling");
            assertThat(run.getExecutionState().get("bad").getStatus()).isEqualTo(NodeStatus.ERROR);
        }

        @Test
        void shouldEmitErrorLogBeforeWorkflowError() throws Exception {
            fixture.start(new TestExecutors.Flaky(Integer.MAX_VALUE));

            run("events", graph()
                    .node("start", "Start")
                    .node("bad", "Flaky")
                    .connect("start", "bad"));

            List<RecordingEventSink.Event> events = fixture.sink.all();
            int errorLog = indexOf(events, e -> e.name().equals(ExecutionEventPublisher.LOG_ENTRY)
                    && "error".equals(e.payload().get("level")));
            int workflowError = indexOf(events, e -> e.name().equals(ExecutionEventPublisher.WORKFLOW_UPDATE)
                    && "error".equals(e.payload().get("status")));
            assertThat(errorLog).isNotNegative();
            assertThat(workflowError).isGreaterThan(errorLog);
            assertThat(fixture.sink.nodeStatuses("bad")).containsExactly("running", "error");
        }

        @Test
        void shouldRejectUnknownTypeBeforeAnyNodeRuns() throws Exception {
            fixture.start();

            WorkflowRun run = run("bogus", graph()
                    .node("start", "Start")
                    .node("x", "Teleport")
                    .connect("start", "x"));

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.ERROR);
            assertThat(run.getError()).isEqualTo("Unknown node type(s): Teleport");
            assertThat(fixture.sink.named(ExecutionEventPublisher.NODE_UPDATE)).isEmpty();
        }

        private int indexOf(List<RecordingEventSink.Event> events,
                            Predicate<RecordingEventSink.Event> match) {
            for (int i = 0; i < events.size(); i++) {
                if (match.test(events.get(i))) {
                    return i;
                }
            }
            return -1;
        }
    }

    @Nested
    class Admission {

        @Test
        void shouldRejectGraphWithoutStart() {
            fixture.start(recorder);
            Graphs g = graph().node("a", "Record");

            assertThatThrownBy(() -> fixture.engine.executeWorkflow("no-start", g.nodes(), g.connections()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Workflow must have exactly one Start node");
        }

        @Test
        void shouldRejectGraphWithTwoStarts() {
            fixture.start();
            Graphs g = graph().node("s1", "Start").node("s2", "Start");

            assertThatThrownBy(() -> fixture.engine.executeWorkflow("two-starts", g.nodes(), g.connections()))
                    .isInstanceOf(ValidationException.class);
            assertThat(fixture.engine.getMetrics().totalWorkflows()).isZero();
        }

        @Test
        void shouldRejectWhenAtCapacity() {
            fixture.workflow().setMaxConcurrentWorkflows(1);
            fixture.start();
            Graphs slow = slowGraph();

            fixture.engine.executeWorkflow("first", slow.nodes(), slow.connections());

            assertThatThrownBy(() -> fixture.engine.executeWorkflow("second", slow.nodes(), slow.connections()))
                    .isInstanceOf(CapacityException.class)
                    .hasMessage("Maximum concurrent workflows reached (1)");
        }

        @Test
        void shouldRejectDuplicateActiveId() {
            fixture.start();
            Graphs slow = slowGraph();

            fixture.engine.executeWorkflow("same", slow.nodes(), slow.connections());

            assertThatThrownBy(() -> fixture.engine.executeWorkflow("same", slow.nodes(), slow.connections()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("already running");
        }

        @Test
        void shouldRejectMissingWorkflowIdWithoutHoldingCapacity() throws Exception {
            fixture.workflow().setMaxConcurrentWorkflows(1);
            fixture.start();
            Graphs g = graph().node("start", "Start");

            assertThatThrownBy(() -> fixture.engine.executeWorkflow(null, g.nodes(), g.connections()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Workflow id is required");
            assertThatThrownBy(() -> fixture.engine.executeWorkflow("  ", g.nodes(), g.connections()))
                    .isInstanceOf(ValidationException.class);

            assertThat(fixture.engine.getRunningWorkflows()).isEmpty();
            assertThat(run("after-null", g).getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        }

        @Test
        void shouldRejectDuplicateNodeIds() {
            fixture.start(recorder);
            Graphs g = graph()
                    .node("s", "Start")
                    .node("a", "Record")
                    .node("a", "Delay")
                    .connect("s", "a");

            assertThatThrownBy(() -> fixture.engine.executeWorkflow("dup-nodes", g.nodes(), g.connections()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Duplicate node id: a");
            assertThat(recorder.visits).isEmpty();
        }

        @Test
        void shouldRejectNodeWithoutId() {
            fixture.start(recorder);
            Graphs g = graph().node("s", "Start").node(null, "Record");

            assertThatThrownBy(() -> fixture.engine.executeWorkflow("null-node", g.nodes(), g.connections()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Every node needs an id");
            assertThat(fixture.engine.getRunningWorkflows()).isEmpty();
        }

        @Test
        void shouldQueueAndStartInSubmissionOrder() throws Exception {
            fixture.workflow().setMaxConcurrentWorkflows(1);
            fixture.workflow().setQueueEnabled(true);
            fixture.start();
            Graphs g = graph()
                    .node("start", "Start")
                    .node("pause", "Delay", Map.of("duration", 200))
                    .connect("start", "pause");

            CompletableFuture<WorkflowRun> first = fixture.engine.executeWorkflow("q1", g.nodes(), g.connections());
            CompletableFuture<WorkflowRun> second = fixture.engine.executeWorkflow("q2", g.nodes(), g.connections());

            assertThat(fixture.engine.getQueuedWorkflows()).extracting(WorkflowRun::getId).containsExactly("q2");
            assertThat(fixture.engine.getMetrics().queuedWorkflows()).isEqualTo(1);
            assertThat(fixture.sink.workflowStatuses("q2")).startsWith("queued");

            WorkflowRun done2 = second.get(10, TimeUnit.SECONDS);
            WorkflowRun done1 = first.get(10, TimeUnit.SECONDS);
            assertThat(done1.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(done2.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(done2.getStartTime()).isGreaterThanOrEqualTo(done1.getEndTime());
        }
    }

    @Nested
    class StopAndTimeout {

        @Test
        void shouldStopRunningWorkflow() throws Exception {
            fixture.start(recorder);
            Graphs g = graph()
                    .node("start", "Start")
                    .node("pause", "Delay", Map.of("duration", 10, "unit", "seconds"))
                    .node("end", "Record")
                    .connect("start", "pause")
                    .connect("pause", "end");
            CompletableFuture<WorkflowRun> future = fixture.engine.executeWorkflow("stop-me", g.nodes(), g.connections());
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> fixture.sink.nodeStatuses("pause").contains("running"));

            assertThat(fixture.engine.stopWorkflow("stop-me")).isTrue();

            WorkflowRun run = future.get(5, TimeUnit.SECONDS);
            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.STOPPED);
            assertThat(run.isCancelled()).isTrue();
            assertThat(run.getDuration()).isLessThan(10_000L);
            assertThat(fixture.engine.getStatus("stop-me")).isEmpty();
            assertThat(fixture.engine.getLatestHistory("stop-me"))
                    .hasValueSatisfying(h -> assertThat(h.status()).isEqualTo(WorkflowStatus.STOPPED));
            Thread.sleep(100);
            assertThat(recorder.visits).isEmpty();
        }

        @Test
        void shouldReturnFalseWhenStoppingUnknownRun() {
            fixture.start();

            assertThat(fixture.engine.stopWorkflow("nope")).isFalse();
        }

        @Test
        void shouldStopWaitingForParallelBranchesWhenInterrupted() throws Exception {
            fixture.start(recorder);
            Graphs g = graph()
                    .node("start", "Start", Map.of("parallelBranches", true))
                    .node("left", "Record", Map.of("sleepMillis", 3000))
                    .node("right", "Record", Map.of("sleepMillis", 3000))
                    .connect("start", "left")
                    .connect("start", "right");
            WorkflowRun run = new WorkflowRun("branch-wait", g.nodes(), g.connections());
            AtomicReference<Throwable> failure = new AtomicReference<>();
            Thread worker = new Thread(() -> {
                try {
                    fixture.graph.execute(run);
                } catch (RuntimeException e) {
                    failure.set(e);
                }
            });
            worker.start();
            await().atMost(Duration.ofSeconds(5)).until(() -> recorder.visits.size() == 2);

            worker.interrupt();
            worker.join(1000);

            assertThat(worker.isAlive()).isFalse();
            assertThat(failure.get()).isInstanceOf(WorkflowCancelledException.class);
        }

        @Test
        void shouldTimeOutLongRun() throws Exception {
            fixture.workflow().setDefaultTimeout(Duration.ofMillis(200));
            fixture.start();

            WorkflowRun run = run("slow", slowGraph());

            assertThat(run.getStatus()).isEqualTo(WorkflowStatus.ERROR);
            assertThat(run.getError()).isEqualTo("Workflow execution timeout");
            assertThat(fixture.engine.getMetrics().errorsByType())
                    .containsEntry("Workflow execution timeout", 1L);
        }
    }

    @Nested
    class Reporting {

        @Test
        void shouldAggregateMetricsAcrossRuns() throws Exception {
            fixture.start(new TestExecutors.Flaky(Integer.MAX_VALUE));
            Graphs ok = graph().node("start", "Start");
            Graphs bad = graph().node("start", "Start").node("bad", "Flaky").connect("start", "bad");

            run("m1", ok);
            run("m2", ok);
            run("m3", bad);

            MetricsSnapshot metrics = fixture.engine.getMetrics();
            assertThat(metrics.totalWorkflows()).isEqualTo(3);
            assertThat(metrics.successfulWorkflows()).isEqualTo(2);
            assertThat(metrics.failedWorkflows()).isEqualTo(1);
            assertThat(metrics.successRate()).isEqualTo("66.67%");
            assertThat(metrics.nodeExecutions()).isEqualTo(4);
            assertThat(metrics.runningWorkflows()).isZero();
            assertThat(fixture.engine.getHistory(10)).extracting(HistoryEntry::id).containsExactly("m1", "m2", "m3");
        }

        @Test
        void shouldPublishRunningThenTerminalStatus() throws Exception {
            fixture.start();

            run("events-ok", graph().node("start", "Start"));

            assertThat(fixture.sink.workflowStatuses("events-ok")).containsExactly("running", "completed");
            assertThat(fixture.sink.nodeStatuses("start")).containsExactly("running", "completed");
        }
    }

    private static Graphs slowGraph() {
        return graph()
                .node("start", "Start")
                .node("pause", "Delay", Map.of("duration", 30, "unit", "seconds"))
                .connect("start", "pause");
    }
}
