package org.adcp.broker.adserver;

import org.adcp.broker.adserver.model.AssociationResult;
import org.adcp.broker.adserver.model.LineItemSpec;
import org.adcp.broker.adserver.model.OrderResult;
import org.adcp.broker.adserver.model.OrderSpec;
import org.adcp.broker.adserver.model.SlotRef;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link AdServerClient} that only logs what would be sent and answers with ids derived from its input,
 * so repeated calls with the same input return the same ids.
 */
public class DryRunAdServerClient implements AdServerClient {

    private static final Logger logger = LoggerFactory.getLogger(DryRunAdServerClient.class);

    @Override
    public OrderResult applyLineItems(OrderSpec orderSpec) {
        final Map<String, String> lineItemIds = new LinkedHashMap<>();
        for (LineItemSpec lineItem : orderSpec.getLineItems()) {
            lineItemIds.put(lineItem.getPackageId(), "dry_run_line_item_" + lineItem.getPackageId());
        }

        logger.info("Would apply order '{}' with {} line item(s)",
                orderSpec.getIdempotencyKey(), lineItemIds.size());
        return OrderResult.of("dry_run_order_" + orderSpec.getIdempotencyKey(), lineItemIds);
    }

    @Override
    public AssociationResult associateCreative(String assetId, SlotRef slotRef) {
        logger.info("Would associate creative {} with line item {} placeholder {}",
                assetId, slotRef.getLineItemId(), slotRef.getSlot().describe());
        return AssociationResult.of("dry_run_creative_" + assetId, false);
    }
}
