package org.adcp.broker.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.collections4.CollectionUtils;

import java.util.List;

/**
 * Business outcome of an operation. Carries no transport metadata: status, task ids and messages are
 * derived from it at the transport boundary.
 */
@Builder(toBuilder = true)
@Value
public class DomainResult {

    Operation operation;

    String buyerRef;

    String mediaBuyId;

    @Singular
    List<ItemOutcome> items;

    /**
     * Unrecoverable errors of the operation as a whole.
     */
    @Singular
    List<BrokerError> errors;

    PendingReason pendingReason;

    public boolean hasErrors() {
        return CollectionUtils.isNotEmpty(errors);
    }

    public long count(ItemStatus status) {
        return items.stream().filter(item -> item.getStatus() == status).count();
    }
}
