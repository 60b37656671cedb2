package org.adcp.broker.adserver.model;

import lombok.Builder;
import lombok.Value;
import org.adcp.broker.creative.model.PlaceholderSlot;
import org.adcp.broker.targeting.model.TargetingOverlay;

import java.math.BigDecimal;
import java.util.List;

@Builder
@Value
public class LineItemSpec {

    String packageId;

    String productId;

    List<String> formatIds;

    List<PlaceholderSlot> placeholders;

    BigDecimal budget;

    TargetingOverlay targeting;
}
