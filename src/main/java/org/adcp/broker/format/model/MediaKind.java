package org.adcp.broker.format.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MediaKind {

    DISPLAY,
    VIDEO,
    AUDIO,
    NATIVE;

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
