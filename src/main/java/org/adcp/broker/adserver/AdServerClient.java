package org.adcp.broker.adserver;

import org.adcp.broker.adserver.model.AssociationResult;
import org.adcp.broker.adserver.model.OrderResult;
import org.adcp.broker.adserver.model.OrderSpec;
import org.adcp.broker.adserver.model.SlotRef;
import org.adcp.broker.exception.AdServerException;

/**
 * Ad-server collaborator. Both operations must be idempotent for the caller-supplied key
 * ({@link OrderSpec#getIdempotencyKey()}, asset id plus slot reference) so they can be retried.
 */
public interface AdServerClient {

    OrderResult applyLineItems(OrderSpec orderSpec) throws AdServerException;

    AssociationResult associateCreative(String assetId, SlotRef slotRef) throws AdServerException;
}
