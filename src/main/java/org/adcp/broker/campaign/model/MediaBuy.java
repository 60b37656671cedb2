package org.adcp.broker.campaign.model;

import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Value(staticConstructor = "of")
public class MediaBuy {

    String mediaBuyId;

    String tenantId;

    List<CampaignPackage> packages;

    public Optional<CampaignPackage> findPackage(String packageId) {
        return packages.stream()
                .filter(campaignPackage -> Objects.equals(campaignPackage.getPackageId(), packageId))
                .findFirst();
    }
}
