package com.runtimehub.runtime_engine.engine.exception;

/** Malformed submission or unknown node type. Never retried. */
public class ValidationException extends WorkflowException {

    public ValidationException(String message) {
        super(message);
    }
}
