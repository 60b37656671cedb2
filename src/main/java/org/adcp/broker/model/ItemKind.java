package org.adcp.broker.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemKind {

    PACKAGE("package", "packages"),
    CREATIVE("creative", "creatives");

    private final String singular;
    private final String plural;

    ItemKind(String singular, String plural) {
        this.singular = singular;
        this.plural = plural;
    }

    public String noun(long count) {
        return count == 1 ? singular : plural;
    }

    @Override
    @JsonValue
    public String toString() {
        return singular;
    }
}
