package org.adcp.broker.targeting.model;

import lombok.Value;

@Value
public class DimensionClassification {

    String name;

    AccessClass access;

    String description;
}
