package org.adcp.broker.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorCode {

    INVALID_PACKAGE,
    UNKNOWN_FORMAT,
    NO_PLACEHOLDERS_CONFIGURED,
    SLOT_MISMATCH,
    MANAGED_ONLY_VIOLATION,
    UNKNOWN_TARGETING_DIMENSION,
    UPSTREAM_AD_SERVER_ERROR,
    CANCELLED;

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
