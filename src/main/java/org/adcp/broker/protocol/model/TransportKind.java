package org.adcp.broker.protocol.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransportKind {

    /**
     * Tool invocation result: text content plus structured content.
     */
    TOOL_CALL,

    /**
     * Task with status and data artifacts.
     */
    TASK_ARTIFACT;

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
