package org.adcp.broker.protocol.model;

import lombok.Builder;
import lombok.Value;
import org.adcp.broker.model.DomainResult;

import java.time.Instant;

/**
 * Transport wrapper around a {@link DomainResult}. Built only at the transport boundary and never persisted.
 */
@Builder
@Value
public class ProtocolEnvelope {

    TransportKind transport;

    TaskStatus status;

    String taskId;

    String contextId;

    String message;

    Instant timestamp;

    DomainResult payload;
}
