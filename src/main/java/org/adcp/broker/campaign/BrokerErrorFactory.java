package org.adcp.broker.campaign;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.adcp.broker.creative.model.PlaceholderSlot;
import org.adcp.broker.creative.model.PlaceholderValidationResult;
import org.adcp.broker.exception.AdServerException;
import org.adcp.broker.exception.ManagedOnlyViolationException;
import org.adcp.broker.exception.UnknownFormatException;
import org.adcp.broker.exception.UnknownTargetingDimensionException;
import org.adcp.broker.json.JacksonMapper;
import org.adcp.broker.model.BrokerError;
import org.adcp.broker.model.ErrorCode;

import java.util.Objects;

/**
 * Turns engine exceptions and rejections into {@link BrokerError}s with structured details.
 */
public class BrokerErrorFactory {

    private final JacksonMapper mapper;

    public BrokerErrorFactory(JacksonMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public BrokerError missingPackageId(int packageIndex) {
        return BrokerError.of(ErrorCode.INVALID_PACKAGE, "Package at index %d has no package_id".formatted(packageIndex),
                details().put("package_index", packageIndex));
    }

    public BrokerError duplicatePackageId(String packageId) {
        return BrokerError.of(ErrorCode.INVALID_PACKAGE, "Duplicate package_id: " + packageId,
                details().put("package_id", packageId));
    }

    public BrokerError unknownFormat(UnknownFormatException e, String packageId) {
        final ObjectNode details = details()
                .put("format_id", e.getFormatId())
                .put("package_id", packageId);
        final ArrayNode scopes = details.putArray("searched_scopes");
        e.getSearchedScopes().forEach(scope -> scopes.add(scope.toString()));
        return BrokerError.of(ErrorCode.UNKNOWN_FORMAT, e.getMessage(), details);
    }

    public BrokerError managedOnlyViolation(ManagedOnlyViolationException e) {
        return BrokerError.of(ErrorCode.MANAGED_ONLY_VIOLATION, e.getMessage(),
                details().put("dimension", e.getDimension()));
    }

    public BrokerError unknownTargetingDimension(UnknownTargetingDimensionException e) {
        final ObjectNode details = details();
        final ArrayNode dimensions = details.putArray("dimensions");
        e.getDimensions().forEach(dimensions::add);
        return BrokerError.of(ErrorCode.UNKNOWN_TARGETING_DIMENSION, e.getMessage(), details);
    }

    public BrokerError placeholderRejection(PlaceholderValidationResult result) {
        final ErrorCode code = switch (result.getReason()) {
            case NO_PLACEHOLDERS_CONFIGURED -> ErrorCode.NO_PLACEHOLDERS_CONFIGURED;
            case SLOT_MISMATCH -> ErrorCode.SLOT_MISMATCH;
        };

        final ObjectNode details = details();
        final ArrayNode attempted = details.putArray("attempted_slots");
        for (PlaceholderSlot slot : result.getAttemptedSlots()) {
            final JsonNode slotNode = mapper.mapper().valueToTree(slot);
            attempted.add(slotNode);
        }
        return BrokerError.of(code, result.getMessage(), details);
    }

    public BrokerError upstream(AdServerException e) {
        return e.isCancelled()
                ? BrokerError.of(ErrorCode.CANCELLED, "Ad server call cancelled: " + e.getMessage())
                : BrokerError.of(ErrorCode.UPSTREAM_AD_SERVER_ERROR, "Ad server error: " + e.getMessage());
    }

    private ObjectNode details() {
        return mapper.mapper().createObjectNode();
    }
}
