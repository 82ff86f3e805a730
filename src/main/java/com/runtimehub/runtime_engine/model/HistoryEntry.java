package com.runtimehub.runtime_engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Immutable snapshot of a finished run, kept in the bounded history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntry(
        String id,
        WorkflowStatus status,
        String error,
        Long startTime,
        Long endTime,
        Long duration,
        int nodeCount,
        int completedNodeCount
) {

    public static HistoryEntry from(WorkflowRun run) {
        return new HistoryEntry(
                run.getId(),
                run.getStatus(),
                run.getError(),
                run.getStartTime(),
                run.getEndTime(),
                run.getDuration(),
                run.getNodes().size(),
                run.getCompletedNodeCount()
        );
    }
}
