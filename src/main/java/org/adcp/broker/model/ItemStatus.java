package org.adcp.broker.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemStatus {

    ACCEPTED,
    REJECTED,
    PENDING;

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
