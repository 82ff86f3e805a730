package com.runtimehub.runtime_engine.engine.exception;

/**
 * Root of every engine failure. Unchecked; callers at the REST edge map subtypes to status codes.
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
