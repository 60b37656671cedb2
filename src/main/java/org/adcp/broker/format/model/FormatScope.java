package org.adcp.broker.format.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lookup scopes of a format identifier, declared in resolution order.
 */
public enum FormatScope {

    PRODUCT,
    TENANT,
    STANDARD;

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
