package org.adcp.broker.creative.model;

import lombok.Value;

import java.util.List;

@Value(staticConstructor = "of")
public class PackagePlaceholders {

    String packageId;

    List<PlaceholderSlot> slots;
}
