package org.adcp.broker.targeting.model;

import lombok.Value;

import java.util.List;

@Value
public class ClassificationFile {

    List<DimensionClassification> dimensions;
}
