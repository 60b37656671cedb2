package org.adcp.broker.format.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

/**
 * A named creative specification plus its ad-server placement configuration.
 * <p>
 * Entries held by tenant and product scopes may be partial: any field left null is inherited
 * from the lower scope during resolution. {@code placementConfig} is keyed by ad-server backend
 * (for example {@code gam}) and deep-merged across scopes.
 */
@Builder(toBuilder = true)
@Value
public class FormatDefinition {

    String formatId;

    String name;

    MediaKind mediaKind;

    FormatRequirements requirements;

    ObjectNode placementConfig;

    /**
     * Scope that supplied the winning definition, set on resolved definitions only.
     */
    FormatScope scope;

    public JsonNode placementConfigFor(String adServer) {
        return placementConfig != null ? placementConfig.get(adServer) : null;
    }
}
