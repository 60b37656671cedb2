package org.adcp.broker.targeting.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.collections4.MapUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Targeting values injected by the operator's signal engine. Only ever built by trusted internal code,
 * never from request input.
 */
@EqualsAndHashCode
@ToString
public final class ManagedSignals {

    private static final ManagedSignals NONE = new ManagedSignals(Collections.emptyMap());

    private final Map<String, JsonNode> signals;

    private ManagedSignals(Map<String, JsonNode> signals) {
        this.signals = signals;
    }

    public static ManagedSignals of(Map<String, JsonNode> signals) {
        return MapUtils.isEmpty(signals)
                ? NONE
                : new ManagedSignals(Collections.unmodifiableMap(new LinkedHashMap<>(signals)));
    }

    public static ManagedSignals none() {
        return NONE;
    }

    public Map<String, JsonNode> getSignals() {
        return signals;
    }
}
