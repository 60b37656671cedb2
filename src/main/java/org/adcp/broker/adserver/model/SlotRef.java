package org.adcp.broker.adserver.model;

import lombok.Value;
import org.adcp.broker.creative.model.PlaceholderSlot;

@Value(staticConstructor = "of")
public class SlotRef {

    String orderId;

    String packageId;

    String lineItemId;

    PlaceholderSlot slot;
}
