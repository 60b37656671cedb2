package org.adcp.broker.campaign.model;

import lombok.Builder;
import lombok.Value;
import org.adcp.broker.targeting.model.TargetingOverlay;

import java.util.List;

@Builder(toBuilder = true)
@Value
public class CreateMediaBuyRequest {

    String buyerRef;

    String tenantId;

    List<PackageRequest> packages;

    TargetingOverlay targetingOverlay;

    /**
     * Set from tenant configuration when new orders need manual approval before going live.
     */
    boolean manualApprovalRequired;
}
