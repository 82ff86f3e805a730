package com.runtimehub.runtime_engine.engine.exception;

import lombok.Getter;

@Getter
public class NodeExecutionException extends WorkflowException {

    private final String nodeId;
    private final String nodeType;

    public NodeExecutionException(String nodeId, String nodeType, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.nodeType = nodeType;
    }
}
