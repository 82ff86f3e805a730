package com.runtimehub.runtime_engine.engine.exception;

public class WorkflowCancelledException extends WorkflowException {

    public WorkflowCancelledException(String message) {
        super(message);
    }
}
