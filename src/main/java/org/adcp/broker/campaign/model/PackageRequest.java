package org.adcp.broker.campaign.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Builder
@Value
public class PackageRequest {

    String packageId;

    String productId;

    List<String> formatIds;

    BigDecimal budget;
}
