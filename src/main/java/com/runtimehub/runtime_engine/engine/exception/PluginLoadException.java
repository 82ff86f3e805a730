package com.runtimehub.runtime_engine.engine.exception;

public class PluginLoadException extends WorkflowException {

    public PluginLoadException(String message) {
        super(message);
    }

    public PluginLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
