package org.adcp.broker.adserver.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Order with its line items. {@code idempotencyKey} lets the ad server collapse retried submissions.
 */
@Builder
@Value
public class OrderSpec {

    String idempotencyKey;

    String tenantId;

    String buyerRef;

    List<LineItemSpec> lineItems;
}
