package com.runtimehub.runtime_engine.model;

import java.util.Map;

public record MetricsSnapshot(
        long totalWorkflows,
        long successfulWorkflows,
        long failedWorkflows,
        long stoppedWorkflows,
        long nodeExecutions,
        long totalExecutionTime,
        long averageExecutionTime,
        Map<String, Long> errorsByType,
        String successRate,
        int runningWorkflows,
        int queuedWorkflows,
        int maxConcurrentWorkflows
) {}
