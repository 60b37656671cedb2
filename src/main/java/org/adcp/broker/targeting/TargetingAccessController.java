package org.adcp.broker.targeting;

import com.fasterxml.jackson.databind.JsonNode;
import org.adcp.broker.exception.ManagedOnlyViolationException;
import org.adcp.broker.exception.UnknownTargetingDimensionException;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;
import org.adcp.broker.targeting.model.AccessClass;
import org.adcp.broker.targeting.model.ManagedSignals;
import org.adcp.broker.targeting.model.TargetingOverlay;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides which targeting dimensions a buyer may set and merges operator signals into the result.
 * <p>
 * Buyer input is checked completely before any signal is merged, so a managed-only value can never
 * originate from the buyer. The effective overlay lists dimensions in classification order, which makes
 * the output identical for identical input.
 */
public class TargetingAccessController {

    private static final Logger logger = LoggerFactory.getLogger(TargetingAccessController.class);

    private final TargetingClassification classification;

    public TargetingAccessController(TargetingClassification classification) {
        this.classification = Objects.requireNonNull(classification);
    }

    /**
     * @throws ManagedOnlyViolationException      naming the first managed-only dimension, in declaration order,
     *                                            found in the buyer overlay
     * @throws UnknownTargetingDimensionException when the buyer overlay holds undeclared dimensions
     * @throws IllegalArgumentException           when signals target an undeclared or overlay-only dimension
     */
    public TargetingOverlay apply(TargetingOverlay externalOverlay, ManagedSignals managedSignals) {
        final TargetingOverlay external = externalOverlay != null ? externalOverlay : TargetingOverlay.empty();
        final Map<String, JsonNode> signals = managedSignals != null
                ? managedSignals.getSignals()
                : ManagedSignals.none().getSignals();

        rejectManagedOnly(external);
        rejectUndeclared(external);
        checkSignals(signals);

        final Map<String, JsonNode> effective = new LinkedHashMap<>();
        for (String dimension : classification.dimensions()) {
            final AccessClass accessClass = classification.accessClass(dimension);
            if (accessClass.acceptsManagedSignals() && signals.containsKey(dimension)) {
                effective.put(dimension, signals.get(dimension));
            } else if (external.contains(dimension)) {
                effective.put(dimension, external.get(dimension));
            }
        }

        return TargetingOverlay.of(effective);
    }

    private void rejectManagedOnly(TargetingOverlay external) {
        for (String dimension : classification.dimensions()) {
            if (external.contains(dimension) && classification.accessClass(dimension) == AccessClass.MANAGED_ONLY) {
                logger.warn("Rejected buyer targeting on managed-only dimension '{}'", dimension);
                throw new ManagedOnlyViolationException(dimension);
            }
        }
    }

    private void rejectUndeclared(TargetingOverlay external) {
        final List<String> undeclared = external.dimensionNames().stream()
                .filter(dimension -> !classification.isDeclared(dimension))
                .sorted()
                .toList();
        if (!undeclared.isEmpty()) {
            logger.warn("Rejected buyer targeting on unknown dimension(s) {}", undeclared);
            throw new UnknownTargetingDimensionException(undeclared);
        }
    }

    private void checkSignals(Map<String, JsonNode> signals) {
        for (String dimension : signals.keySet()) {
            final AccessClass accessClass = classification.accessClass(dimension);
            if (accessClass == null || !accessClass.acceptsManagedSignals()) {
                throw new IllegalArgumentException(
                        "Managed signal supplied for dimension '%s' with access class %s"
                                .formatted(dimension, accessClass));
            }
        }
    }
}
