package org.adcp.broker.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Operation {

    CREATE_MEDIA_BUY("Media buy creation"),
    SYNC_CREATIVES("Creative sync");

    private final String displayName;

    Operation(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
