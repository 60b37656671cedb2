package org.adcp.broker.targeting.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Who may set a targeting dimension.
 */
public enum AccessClass {

    /**
     * Settable by the buyer.
     */
    OVERLAY("overlay"),

    /**
     * Settable only through the trusted signal path.
     */
    MANAGED_ONLY("managed_only"),

    /**
     * Settable by both; managed values replace buyer values.
     */
    HYBRID("hybrid", "both");

    private final String value;
    private final String[] aliases;

    AccessClass(String value, String... aliases) {
        this.value = value;
        this.aliases = aliases;
    }

    public boolean acceptsManagedSignals() {
        return this != OVERLAY;
    }

    @JsonCreator
    public static AccessClass fromString(String value) {
        for (AccessClass accessClass : values()) {
            if (accessClass.value.equalsIgnoreCase(value)
                    || Arrays.stream(accessClass.aliases).anyMatch(alias -> alias.equalsIgnoreCase(value))) {
                return accessClass;
            }
        }
        throw new IllegalArgumentException("Unknown targeting access class: " + value);
    }

    @Override
    @JsonValue
    public String toString() {
        return value;
    }
}
