package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.model.MetricsSnapshot;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import com.runtimehub.runtime_engine.model.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowMetricsTest {

    private final WorkflowMetrics metrics = new WorkflowMetrics();

    private static WorkflowRun finished(String id, WorkflowStatus status, String error) {
        WorkflowRun run = new WorkflowRun(id, List.of(NodeDefinition.of("start", "Start")), List.of());
        run.markRunning();
        run.incrementNodeExecutions();
        run.finish(status, error);
        return run;
    }

    @Test
    void shouldReportZeroRateWithoutRuns() {
        MetricsSnapshot snapshot = metrics.snapshot(0, 0, 5);

        assertThat(snapshot.successRate()).isEqualTo("0%");
        assertThat(snapshot.averageExecutionTime()).isZero();
        assertThat(snapshot.maxConcurrentWorkflows()).isEqualTo(5);
    }

    @Test
    void shouldCountOutcomesAndGroupErrors() {
        metrics.record(finished("a", WorkflowStatus.COMPLETED, null));
        metrics.record(finished("b", WorkflowStatus.ERROR, "Workflow execution timeout"));
        metrics.record(finished("c", WorkflowStatus.ERROR, "Unknown node type(s): Foo"));
        metrics.record(finished("d", WorkflowStatus.ERROR, "Unknown node type(s): Bar"));
        metrics.record(finished("e", WorkflowStatus.STOPPED, null));

        MetricsSnapshot snapshot = metrics.snapshot(1, 2, 5);

        assertThat(snapshot.totalWorkflows()).isEqualTo(5);
        assertThat(snapshot.successfulWorkflows()).isEqualTo(1);
        assertThat(snapshot.failedWorkflows()).isEqualTo(3);
        assertThat(snapshot.stoppedWorkflows()).isEqualTo(1);
        assertThat(snapshot.nodeExecutions()).isEqualTo(5);
        assertThat(snapshot.successRate()).isEqualTo("20.00%");
        assertThat(snapshot.errorsByType())
                .containsEntry("Workflow execution timeout", 1L)
                .containsEntry("Unknown node type(s)", 2L);
        assertThat(snapshot.runningWorkflows()).isEqualTo(1);
        assertThat(snapshot.queuedWorkflows()).isEqualTo(2);
    }

    @Test
    void shouldFallBackToUnknownErrorType() {
        assertThat(WorkflowMetrics.errorType(null)).isEqualTo("Unknown");
        assertThat(WorkflowMetrics.errorType(" ")).isEqualTo("Unknown");
        assertThat(WorkflowMetrics.errorType("boom")).isEqualTo("boom");
    }
}
