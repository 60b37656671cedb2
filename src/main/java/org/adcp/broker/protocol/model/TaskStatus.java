package org.adcp.broker.protocol.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {

    COMPLETED,
    PARTIAL,
    PENDING,
    FAILED;

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
