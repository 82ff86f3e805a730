package com.runtimehub.runtime_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowStatus {
    PENDING,    // admitted to the queue, waiting for a free slot
    RUNNING,
    COMPLETED,
    ERROR,
    STOPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == STOPPED;
    }
}
