package org.adcp.broker.targeting;

import org.adcp.broker.targeting.model.AccessClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable dimension name to {@link AccessClass} table. Iteration follows declaration order.
 */
public final class TargetingClassification {

    private final Map<String, AccessClass> dimensionToAccess;

    private TargetingClassification(Map<String, AccessClass> dimensionToAccess) {
        this.dimensionToAccess = dimensionToAccess;
    }

    public static TargetingClassification of(Map<String, AccessClass> dimensionToAccess) {
        return new TargetingClassification(Collections.unmodifiableMap(new LinkedHashMap<>(dimensionToAccess)));
    }

    public AccessClass accessClass(String dimension) {
        return dimensionToAccess.get(dimension);
    }

    public boolean isDeclared(String dimension) {
        return dimensionToAccess.containsKey(dimension);
    }

    public List<String> dimensions() {
        return List.copyOf(dimensionToAccess.keySet());
    }

    public int size() {
        return dimensionToAccess.size();
    }
}
