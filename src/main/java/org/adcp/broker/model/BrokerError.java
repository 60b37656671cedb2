package org.adcp.broker.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Structured error carried inside a {@link DomainResult}. {@code details} holds what a caller needs to
 * diagnose the problem without server logs: searched scopes, attempted slots, offending dimension.
 */
@Value(staticConstructor = "of")
public class BrokerError {

    ErrorCode code;

    String message;

    ObjectNode details;

    public static BrokerError of(ErrorCode code, String message) {
        return of(code, message, null);
    }
}
