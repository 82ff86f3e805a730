package com.runtimehub.runtime_engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.Map;

/**
 * Execution state of one node inside one run. Created on first visit; a retry or a loop
 * re-visit starts a new attempt that goes through running again.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeState {

    private NodeStatus status = NodeStatus.IDLE;
    private Long startTime;
    private Long endTime;
    private Long duration;
    private Map<String, Object> result;
    private String error;
    private int retryCount;
    private int attempts;

    public synchronized void markRunning() {
        status = NodeStatus.RUNNING;
        startTime = System.currentTimeMillis();
        endTime = null;
        duration = null;
        result = null;
        error = null;
        attempts++;
    }

    public synchronized void markCompleted(Map<String, Object> result) {
        this.status = NodeStatus.COMPLETED;
        this.result = result;
        finish();
    }

    public synchronized void markFailed(String error) {
        this.status = NodeStatus.ERROR;
        this.error = error;
        finish();
    }

    public synchronized int incrementRetryCount() {
        return ++retryCount;
    }

    public synchronized void resetRetryCount() {
        retryCount = 0;
    }

    private void finish() {
        endTime = System.currentTimeMillis();
        duration = startTime != null ? endTime - startTime : 0L;
    }
}
