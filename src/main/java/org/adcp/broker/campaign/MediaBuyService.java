package org.adcp.broker.campaign;

import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.StringUtils;
import org.adcp.broker.adserver.AdServerClient;
import org.adcp.broker.adserver.model.LineItemSpec;
import org.adcp.broker.adserver.model.OrderResult;
import org.adcp.broker.adserver.model.OrderSpec;
import org.adcp.broker.campaign.model.CampaignPackage;
import org.adcp.broker.campaign.model.CreateMediaBuyRequest;
import org.adcp.broker.campaign.model.MediaBuy;
import org.adcp.broker.campaign.model.MediaBuyOutcome;
import org.adcp.broker.campaign.model.PackageRequest;
import org.adcp.broker.creative.PlaceholderSlotFactory;
import org.adcp.broker.creative.model.PlaceholderSlot;
import org.adcp.broker.exception.AdServerException;
import org.adcp.broker.exception.ManagedOnlyViolationException;
import org.adcp.broker.exception.UnknownFormatException;
import org.adcp.broker.exception.UnknownTargetingDimensionException;
import org.adcp.broker.format.FormatResolver;
import org.adcp.broker.format.model.FormatDefinition;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;
import org.adcp.broker.model.BrokerError;
import org.adcp.broker.model.DomainResult;
import org.adcp.broker.model.ItemKind;
import org.adcp.broker.model.ItemOutcome;
import org.adcp.broker.model.ItemStatus;
import org.adcp.broker.model.Operation;
import org.adcp.broker.model.PendingReason;
import org.adcp.broker.targeting.TargetingAccessController;
import org.adcp.broker.targeting.model.ManagedSignals;
import org.adcp.broker.targeting.model.TargetingOverlay;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Creates media buys: checks targeting, resolves every package format, derives placeholder slots and
 * applies the order on the ad server.
 * <p>
 * Package id, targeting and format problems end the operation before the ad server is called; they are reported
 * as errors of the returned {@link DomainResult}, never thrown.
 */
public class MediaBuyService {

    private static final Logger logger = LoggerFactory.getLogger(MediaBuyService.class);

    private final TargetingAccessController targetingAccessController;
    private final FormatResolver formatResolver;
    private final PlaceholderSlotFactory placeholderSlotFactory;
    private final AdServerClient adServerClient;
    private final BrokerErrorFactory errorFactory;

    public MediaBuyService(TargetingAccessController targetingAccessController,
                           FormatResolver formatResolver,
                           PlaceholderSlotFactory placeholderSlotFactory,
                           AdServerClient adServerClient,
                           BrokerErrorFactory errorFactory) {

        this.targetingAccessController = Objects.requireNonNull(targetingAccessController);
        this.formatResolver = Objects.requireNonNull(formatResolver);
        this.placeholderSlotFactory = Objects.requireNonNull(placeholderSlotFactory);
        this.adServerClient = Objects.requireNonNull(adServerClient);
        this.errorFactory = Objects.requireNonNull(errorFactory);
    }

    /**
     * @param managedSignals signals from the trusted signal path, never derived from the request
     */
    public MediaBuyOutcome createMediaBuy(CreateMediaBuyRequest request, ManagedSignals managedSignals) {
        final DomainResult.DomainResultBuilder result = DomainResult.builder()
                .operation(Operation.CREATE_MEDIA_BUY)
                .buyerRef(request.getBuyerRef());

        final TargetingOverlay targeting;
        try {
            targeting = targetingAccessController.apply(request.getTargetingOverlay(), managedSignals);
        } catch (ManagedOnlyViolationException e) {
            return failed(result.error(errorFactory.managedOnlyViolation(e)));
        } catch (UnknownTargetingDimensionException e) {
            return failed(result.error(errorFactory.unknownTargetingDimension(e)));
        }

        final List<PackageRequest> packages = ListUtils.emptyIfNull(request.getPackages());
        final List<BrokerError> packageErrors = validatePackageIds(packages);
        if (!packageErrors.isEmpty()) {
            return failed(result.errors(packageErrors));
        }

        final List<BrokerError> formatErrors = new ArrayList<>();
        final Map<String, List<PlaceholderSlot>> packageToSlots = new LinkedHashMap<>();
        for (PackageRequest packageRequest : packages) {
            final List<FormatDefinition> formats = resolveFormats(request.getTenantId(), packageRequest, formatErrors);
            packageToSlots.put(packageRequest.getPackageId(), placeholderSlotFactory.slotsFor(formats));
        }
        if (!formatErrors.isEmpty()) {
            return failed(result.errors(formatErrors));
        }

        final OrderSpec orderSpec = OrderSpec.builder()
                .idempotencyKey(request.getBuyerRef())
                .tenantId(request.getTenantId())
                .buyerRef(request.getBuyerRef())
                .lineItems(packages.stream()
                        .map(packageRequest -> LineItemSpec.builder()
                                .packageId(packageRequest.getPackageId())
                                .productId(packageRequest.getProductId())
                                .formatIds(packageRequest.getFormatIds())
                                .placeholders(packageToSlots.get(packageRequest.getPackageId()))
                                .budget(packageRequest.getBudget())
                                .targeting(targeting)
                                .build())
                        .toList())
                .build();

        final OrderResult orderResult;
        try {
            orderResult = adServerClient.applyLineItems(orderSpec);
        } catch (AdServerException e) {
            return upstreamFailure(result, packages, e);
        }

        final ItemStatus packageStatus = request.isManualApprovalRequired() ? ItemStatus.PENDING : ItemStatus.ACCEPTED;
        final List<CampaignPackage> campaignPackages = new ArrayList<>();
        for (PackageRequest packageRequest : packages) {
            final String lineItemId = orderResult.getLineItemIds().get(packageRequest.getPackageId());
            campaignPackages.add(CampaignPackage.of(packageRequest.getPackageId(), packageRequest.getProductId(),
                    lineItemId, packageToSlots.get(packageRequest.getPackageId())));
            result.item(packageOutcome(packageRequest, packageStatus).serverId(lineItemId).build());
        }
        if (request.isManualApprovalRequired()) {
            result.pendingReason(PendingReason.MANUAL_APPROVAL);
        }

        logger.info("Media buy {} created for buyer ref {} with {} package(s)",
                orderResult.getOrderId(), request.getBuyerRef(), campaignPackages.size());
        return MediaBuyOutcome.of(
                result.mediaBuyId(orderResult.getOrderId()).build(),
                MediaBuy.of(orderResult.getOrderId(), request.getTenantId(), List.copyOf(campaignPackages)));
    }

    private List<BrokerError> validatePackageIds(List<PackageRequest> packages) {
        final List<BrokerError> errors = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (int i = 0; i < packages.size(); i++) {
            final String packageId = packages.get(i).getPackageId();
            if (StringUtils.isBlank(packageId)) {
                errors.add(errorFactory.missingPackageId(i));
            } else if (!seen.add(packageId)) {
                errors.add(errorFactory.duplicatePackageId(packageId));
            }
        }
        if (!errors.isEmpty()) {
            logger.warn("Rejecting media buy with {} invalid package id(s)", errors.size());
        }
        return errors;
    }

    private List<FormatDefinition> resolveFormats(String tenantId,
                                                  PackageRequest packageRequest,
                                                  List<BrokerError> errors) {

        final List<FormatDefinition> formats = new ArrayList<>();
        for (String formatId : ListUtils.emptyIfNull(packageRequest.getFormatIds())) {
            try {
                formats.add(formatResolver.resolve(formatId, tenantId, packageRequest.getProductId()));
            } catch (UnknownFormatException e) {
                logger.warn("Package {} requests unknown format: {}", packageRequest.getPackageId(), e.getMessage());
                errors.add(errorFactory.unknownFormat(e, packageRequest.getPackageId()));
            }
        }
        return formats;
    }

    private MediaBuyOutcome upstreamFailure(DomainResult.DomainResultBuilder result,
                                            List<PackageRequest> packages,
                                            AdServerException e) {

        if (e.isTimeout()) {
            // the order may still be created, a retry with the same buyer ref is collapsed by the ad server
            logger.warn("Ad server timed out applying line items: {}", e.getMessage());
            packages.forEach(packageRequest ->
                    result.item(packageOutcome(packageRequest, ItemStatus.PENDING).build()));
            return MediaBuyOutcome.of(result.pendingReason(PendingReason.UPSTREAM_TIMEOUT).build(), null);
        }

        if (e.isCancelled()) {
            logger.warn("Ad server call applying line items was cancelled: {}", e.getMessage());
        } else {
            logger.error("Ad server failed applying line items", e);
        }
        return failed(result.error(errorFactory.upstream(e)));
    }

    private static ItemOutcome.ItemOutcomeBuilder packageOutcome(PackageRequest packageRequest, ItemStatus status) {
        return ItemOutcome.builder()
                .kind(ItemKind.PACKAGE)
                .itemId(packageRequest.getPackageId())
                .status(status);
    }

    private static MediaBuyOutcome failed(DomainResult.DomainResultBuilder result) {
        return MediaBuyOutcome.of(result.build(), null);
    }
}
