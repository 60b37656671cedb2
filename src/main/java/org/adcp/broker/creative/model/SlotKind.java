package org.adcp.broker.creative.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SlotKind {

    /**
     * Creative dimensions must equal the slot dimensions.
     */
    EXACT(false),

    /**
     * 1x1 slot bound to an ad-server native template; the template renders any creative size.
     */
    NATIVE_TEMPLATE(true),

    /**
     * 1x1 slot without template, reserved for programmatic and third-party tags of any size.
     */
    PROGRAMMATIC_WILDCARD(true);

    private final boolean wildcard;

    SlotKind(boolean wildcard) {
        this.wildcard = wildcard;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
