package com.runtimehub.runtime_engine.engine.exception;

public class CapacityException extends WorkflowException {

    public CapacityException(int maxConcurrent) {
        super("Maximum concurrent workflows reached (" + maxConcurrent + ")");
    }
}
