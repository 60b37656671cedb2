package org.adcp.broker.targeting.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.collections4.MapUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Targeting values keyed by dimension name, kept in insertion order.
 */
@EqualsAndHashCode
@ToString
public final class TargetingOverlay {

    private static final TargetingOverlay EMPTY = new TargetingOverlay(Collections.emptyMap());

    private final Map<String, JsonNode> dimensions;

    private TargetingOverlay(Map<String, JsonNode> dimensions) {
        this.dimensions = dimensions;
    }

    @JsonCreator
    public static TargetingOverlay of(Map<String, JsonNode> dimensions) {
        return MapUtils.isEmpty(dimensions)
                ? EMPTY
                : new TargetingOverlay(Collections.unmodifiableMap(new LinkedHashMap<>(dimensions)));
    }

    public static TargetingOverlay empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, JsonNode> getDimensions() {
        return dimensions;
    }

    public JsonNode get(String dimension) {
        return dimensions.get(dimension);
    }

    public boolean contains(String dimension) {
        return dimensions.containsKey(dimension);
    }

    public Set<String> dimensionNames() {
        return dimensions.keySet();
    }

    public boolean isEmpty() {
        return dimensions.isEmpty();
    }
}
