package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.model.MetricsSnapshot;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Process-lifetime counters over finished runs.
 */
@Component
public class WorkflowMetrics {

    private long totalWorkflows;
    private long successfulWorkflows;
    private long failedWorkflows;
    private long stoppedWorkflows;
    private long nodeExecutions;
    private long totalExecutionTime;
    private final Map<String, Long> errorsByType = new LinkedHashMap<>();

    public synchronized void record(WorkflowRun run) {
        totalWorkflows++;
        switch (run.getStatus()) {
            case COMPLETED -> successfulWorkflows++;
            case ERROR -> {
                failedWorkflows++;
                errorsByType.merge(errorType(run.getError()), 1L, Long::sum);
            }
            case STOPPED -> stoppedWorkflows++;
            default -> { }
        }
        nodeExecutions += run.getNodeExecutions().get();
        totalExecutionTime += run.getDuration() != null ? run.getDuration() : 0L;
    }

    public synchronized MetricsSnapshot snapshot(int running, int queued, int maxConcurrent) {
        long average = totalWorkflows > 0 ? Math.round((double) totalExecutionTime / totalWorkflows) : 0L;
        String successRate = totalWorkflows > 0
                ? String.format(Locale.ROOT, "%.2f%%", successfulWorkflows * 100.0 / totalWorkflows)
                : "0%";
        return new MetricsSnapshot(
                totalWorkflows,
                successfulWorkflows,
                failedWorkflows,
                stoppedWorkflows,
                nodeExecutions,
                totalExecutionTime,
                average,
                Map.copyOf(errorsByType),
                successRate,
                running,
                queued,
                maxConcurrent
        );
    }

    /** Text before the first colon, e.g. "Workflow execution timeout" or "Unknown". */
    static String errorType(String error) {
        if (error == null || error.isBlank()) {
            return "Unknown";
        }
        int colon = error.indexOf(':');
        return (colon > 0 ? error.substring(0, colon) : error).trim();
    }
}
