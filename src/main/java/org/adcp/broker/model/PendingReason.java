package org.adcp.broker.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PendingReason {

    MANUAL_APPROVAL("awaiting manual approval"),
    CREATIVE_REVIEW("awaiting creative review"),
    UPSTREAM_TIMEOUT("ad server did not answer in time, the operation continues asynchronously");

    private final String description;

    PendingReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
