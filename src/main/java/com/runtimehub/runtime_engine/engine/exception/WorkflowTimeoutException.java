package com.runtimehub.runtime_engine.engine.exception;

/** Cancellation caused by the run exceeding its deadline. */
public class WorkflowTimeoutException extends WorkflowCancelledException {

    public WorkflowTimeoutException(String message) {
        super(message);
    }
}
