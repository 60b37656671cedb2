package org.adcp.broker.campaign.model;

import lombok.Value;
import org.adcp.broker.model.DomainResult;

/**
 * Result of a media buy creation: the domain result for the caller and, when line items were created,
 * the media buy to keep for later creative syncs.
 */
@Value(staticConstructor = "of")
public class MediaBuyOutcome {

    DomainResult result;

    MediaBuy mediaBuy;
}
