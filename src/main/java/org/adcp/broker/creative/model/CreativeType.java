package org.adcp.broker.creative.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CreativeType {

    HOSTED_ASSET,
    HTML5,
    THIRD_PARTY_TAG,
    NATIVE,
    VAST;

    @Override
    @JsonValue
    public String toString() {
        return super.toString().toLowerCase();
    }
}
