package org.adcp.broker.campaign;

import org.apache.commons.collections4.ListUtils;
import org.adcp.broker.adserver.AdServerClient;
import org.adcp.broker.adserver.model.AssociationResult;
import org.adcp.broker.adserver.model.SlotRef;
import org.adcp.broker.campaign.model.CampaignPackage;
import org.adcp.broker.campaign.model.MediaBuy;
import org.adcp.broker.creative.PlaceholderValidator;
import org.adcp.broker.creative.model.CreativeAsset;
import org.adcp.broker.creative.model.CreativeType;
import org.adcp.broker.creative.model.PackagePlaceholders;
import org.adcp.broker.creative.model.PlaceholderValidationResult;
import org.adcp.broker.exception.AdServerException;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;
import org.adcp.broker.model.BrokerError;
import org.adcp.broker.model.DomainResult;
import org.adcp.broker.model.ItemKind;
import org.adcp.broker.model.ItemOutcome;
import org.adcp.broker.model.ItemStatus;
import org.adcp.broker.model.Operation;
import org.adcp.broker.model.PendingReason;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Syncs creatives into an existing media buy: each asset is validated against the placeholder slots of
 * the packages it is assigned to and associated with every line item that takes it.
 * <p>
 * A rejected creative never stops the others, the outcome is reported per creative. A cancelled ad-server
 * call ends the sync with a {@code cancelled} error.
 */
public class CreativeSyncService {

    private static final Logger logger = LoggerFactory.getLogger(CreativeSyncService.class);

    private final PlaceholderValidator placeholderValidator;
    private final AdServerClient adServerClient;
    private final BrokerErrorFactory errorFactory;

    public CreativeSyncService(PlaceholderValidator placeholderValidator,
                               AdServerClient adServerClient,
                               BrokerErrorFactory errorFactory) {

        this.placeholderValidator = Objects.requireNonNull(placeholderValidator);
        this.adServerClient = Objects.requireNonNull(adServerClient);
        this.errorFactory = Objects.requireNonNull(errorFactory);
    }

    public DomainResult syncCreatives(MediaBuy mediaBuy, List<CreativeAsset> assets) {
        final DomainResult.DomainResultBuilder result = DomainResult.builder()
                .operation(Operation.SYNC_CREATIVES)
                .mediaBuyId(mediaBuy.getMediaBuyId());

        boolean timedOut = false;
        boolean underReview = false;
        for (CreativeAsset asset : ListUtils.emptyIfNull(assets)) {
            final SyncState state = new SyncState();
            try {
                result.item(syncCreative(mediaBuy, asset, state));
            } catch (AdServerException e) {
                // only cancellations escape syncCreative, the remaining creatives are not attempted
                logger.warn("Creative sync for media buy {} cancelled at creative {}: {}",
                        mediaBuy.getMediaBuyId(), asset.getCreativeId(), e.getMessage());
                return result.error(errorFactory.upstream(e)).build();
            }
            timedOut |= state.timedOut;
            underReview |= state.underReview;
        }

        if (timedOut) {
            result.pendingReason(PendingReason.UPSTREAM_TIMEOUT);
        } else if (underReview) {
            result.pendingReason(PendingReason.CREATIVE_REVIEW);
        }
        return result.build();
    }

    private ItemOutcome syncCreative(MediaBuy mediaBuy, CreativeAsset asset, SyncState state) {
        final ItemOutcome.ItemOutcomeBuilder outcome = ItemOutcome.builder()
                .kind(ItemKind.CREATIVE)
                .itemId(asset.getCreativeId());

        // video creatives are served by the VAST tag, not by size placeholders
        if (asset.creativeType() == CreativeType.VAST) {
            logger.debug("Creative {} is VAST, skipping placeholder validation", asset.getCreativeId());
            return outcome.status(ItemStatus.ACCEPTED).build();
        }

        final List<PackagePlaceholders> assignedPackages = assignedPackages(mediaBuy, asset);
        final PlaceholderValidationResult validation = placeholderValidator.validate(asset, assignedPackages);
        if (!validation.isAccepted()) {
            return outcome.status(ItemStatus.REJECTED)
                    .error(errorFactory.placeholderRejection(validation))
                    .build();
        }

        String serverId = null;
        final List<BrokerError> associationErrors = new ArrayList<>();
        for (PlaceholderValidationResult match : placeholderValidator.matchAll(asset, assignedPackages)) {
            final CampaignPackage campaignPackage = mediaBuy.findPackage(match.getMatchedPackageId()).orElseThrow();
            final SlotRef slotRef = SlotRef.of(mediaBuy.getMediaBuyId(), campaignPackage.getPackageId(),
                    campaignPackage.getLineItemId(), match.getMatchedSlot());
            try {
                final AssociationResult association = adServerClient.associateCreative(asset.getCreativeId(), slotRef);
                serverId = association.getCreativeServerId();
                state.underReview |= association.isPendingReview();
            } catch (AdServerException e) {
                if (e.isCancelled()) {
                    throw e;
                }
                if (e.isTimeout()) {
                    logger.warn("Ad server timed out associating creative {} with line item {}",
                            asset.getCreativeId(), campaignPackage.getLineItemId());
                    state.timedOut = true;
                    continue;
                }
                logger.error("Ad server failed associating creative {} with line item {}", e,
                        asset.getCreativeId(), campaignPackage.getLineItemId());
                associationErrors.add(errorFactory.upstream(e));
            }
        }

        // a creative the ad server already holds is never reported rejected, failed associations ride along
        final ItemStatus status;
        if (serverId == null && !state.timedOut && !associationErrors.isEmpty()) {
            status = ItemStatus.REJECTED;
        } else {
            status = state.timedOut || state.underReview ? ItemStatus.PENDING : ItemStatus.ACCEPTED;
        }
        return outcome.status(status).serverId(serverId).errors(associationErrors).build();
    }

    private static List<PackagePlaceholders> assignedPackages(MediaBuy mediaBuy, CreativeAsset asset) {
        final List<PackagePlaceholders> assigned = new ArrayList<>();
        for (String packageId : ListUtils.emptyIfNull(asset.getPackageAssignments())) {
            assigned.add(mediaBuy.findPackage(packageId)
                    .map(campaignPackage -> PackagePlaceholders.of(packageId, campaignPackage.getSlots()))
                    .orElseGet(() -> {
                        logger.warn("Creative {} is assigned to unknown package {}", asset.getCreativeId(), packageId);
                        return PackagePlaceholders.of(packageId, List.of());
                    }));
        }
        return assigned;
    }

    private static class SyncState {

        boolean timedOut;

        boolean underReview;
    }
}
