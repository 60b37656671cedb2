package org.adcp.broker.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a single package or creative within an operation.
 */
@Builder(toBuilder = true)
@Value
public class ItemOutcome {

    ItemKind kind;

    String itemId;

    ItemStatus status;

    String serverId;

    @Singular
    List<BrokerError> errors;
}
