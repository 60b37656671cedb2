package org.adcp.broker.creative;

import org.apache.commons.collections4.CollectionUtils;
import org.adcp.broker.creative.model.CreativeAsset;
import org.adcp.broker.creative.model.CreativeSize;
import org.adcp.broker.creative.model.PackagePlaceholders;
import org.adcp.broker.creative.model.PlaceholderSlot;
import org.adcp.broker.creative.model.PlaceholderValidationResult;
import org.adcp.broker.creative.model.RejectionReason;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Validator for creative sizes against the placeholder slots of the packages a creative is assigned to.
 * <p>
 * A creative is accepted as soon as one slot of one package takes it. Within a package wildcard slots are
 * tried before exact ones.
 */
public class PlaceholderValidator {

    private static final Logger logger = LoggerFactory.getLogger(PlaceholderValidator.class);

    private final CreativeDimensionsResolver dimensionsResolver;

    public PlaceholderValidator(CreativeDimensionsResolver dimensionsResolver) {
        this.dimensionsResolver = Objects.requireNonNull(dimensionsResolver);
    }

    public PlaceholderValidationResult validate(CreativeAsset asset, List<PackagePlaceholders> assignedPackages) {
        final CreativeSize size = dimensionsResolver.resolve(asset);
        final List<PlaceholderSlot> attemptedSlots = new ArrayList<>();
        final List<String> packagesWithoutSlots = new ArrayList<>();

        for (PackagePlaceholders placeholders : CollectionUtils.emptyIfNull(assignedPackages)) {
            final Collection<PlaceholderSlot> slots = CollectionUtils.emptyIfNull(placeholders.getSlots());
            if (slots.isEmpty()) {
                packagesWithoutSlots.add(placeholders.getPackageId());
                continue;
            }

            final PlaceholderSlot matched = findMatchingSlot(slots, size);
            if (matched != null) {
                logger.debug("Creative {} ({}) matched placeholder {} of package {}",
                        asset.getCreativeId(), size, matched.describe(), placeholders.getPackageId());
                return PlaceholderValidationResult.accepted(placeholders.getPackageId(), matched);
            }
            attemptedSlots.addAll(slots);
        }

        return attemptedSlots.isEmpty()
                ? noPlaceholders(asset, packagesWithoutSlots)
                : slotMismatch(asset, size, attemptedSlots);
    }

    /**
     * Returns one accepted result per assigned package holding a slot that takes the creative, in
     * assignment order. Empty when the creative matches nowhere.
     */
    public List<PlaceholderValidationResult> matchAll(CreativeAsset asset,
                                                      List<PackagePlaceholders> assignedPackages) {

        final CreativeSize size = dimensionsResolver.resolve(asset);
        final List<PlaceholderValidationResult> matches = new ArrayList<>();
        for (PackagePlaceholders placeholders : CollectionUtils.emptyIfNull(assignedPackages)) {
            final Collection<PlaceholderSlot> slots = CollectionUtils.emptyIfNull(placeholders.getSlots());
            final PlaceholderSlot matched = findMatchingSlot(slots, size);
            if (matched != null) {
                matches.add(PlaceholderValidationResult.accepted(placeholders.getPackageId(), matched));
            }
        }
        return matches;
    }

    private static PlaceholderSlot findMatchingSlot(Collection<PlaceholderSlot> slots, CreativeSize size) {
        for (PlaceholderSlot slot : slots) {
            if (slot.getKind().isWildcard()) {
                return slot;
            }
        }
        for (PlaceholderSlot slot : slots) {
            if (slot.accepts(size)) {
                return slot;
            }
        }
        return null;
    }

    private static PlaceholderValidationResult noPlaceholders(CreativeAsset asset, List<String> packageIds) {
        final String message = packageIds.isEmpty()
                ? "Creative %s is not assigned to any package with placeholders".formatted(asset.getCreativeId())
                : "No creative placeholders configured for package(s) %s of creative %s"
                .formatted(String.join(", ", packageIds), asset.getCreativeId());

        logger.warn(message);
        return PlaceholderValidationResult.rejected(RejectionReason.NO_PLACEHOLDERS_CONFIGURED, List.of(), message);
    }

    private static PlaceholderValidationResult slotMismatch(CreativeAsset asset,
                                                            CreativeSize size,
                                                            List<PlaceholderSlot> attemptedSlots) {

        final String available = attemptedSlots.stream()
                .map(PlaceholderSlot::describe)
                .collect(Collectors.joining(", "));
        final String message = "Creative %s size %s does not match any of: %s"
                .formatted(asset.getCreativeId(), size, available);

        logger.warn(message);
        return PlaceholderValidationResult.rejected(RejectionReason.SLOT_MISMATCH, attemptedSlots, message);
    }
}
