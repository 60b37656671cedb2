package org.adcp.broker.creative.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlaceholderValidationResult {

    boolean accepted;

    String matchedPackageId;

    PlaceholderSlot matchedSlot;

    RejectionReason reason;

    List<PlaceholderSlot> attemptedSlots;

    String message;

    public static PlaceholderValidationResult accepted(String packageId, PlaceholderSlot slot) {
        return new PlaceholderValidationResult(true, packageId, slot, null, Collections.emptyList(), null);
    }

    public static PlaceholderValidationResult rejected(RejectionReason reason,
                                                       List<PlaceholderSlot> attemptedSlots,
                                                       String message) {

        return new PlaceholderValidationResult(false, null, null, reason, List.copyOf(attemptedSlots), message);
    }
}
