package com.runtimehub.runtime_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
