package org.adcp.broker.format.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Layout of the YAML format settings file: the standard registry, tenant custom formats keyed by
 * tenant id and product overrides keyed by product id.
 */
@Value
public class FormatSettingsFile {

    List<FormatDefinition> standardFormats;

    Map<String, List<FormatDefinition>> tenantFormats;

    Map<String, List<FormatDefinition>> productOverrides;
}
