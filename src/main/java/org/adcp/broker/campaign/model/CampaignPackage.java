package org.adcp.broker.campaign.model;

import lombok.Value;
import org.adcp.broker.creative.model.PlaceholderSlot;

import java.util.List;

/**
 * Package of a created media buy. Its slots are fixed when the line item is created; changing them
 * requires recreating the package.
 */
@Value
public class CampaignPackage {

    String packageId;

    String productId;

    String lineItemId;

    List<PlaceholderSlot> slots;

    public static CampaignPackage of(String packageId, String productId, String lineItemId,
                                     List<PlaceholderSlot> slots) {
        return new CampaignPackage(packageId, productId, lineItemId, List.copyOf(slots));
    }
}
