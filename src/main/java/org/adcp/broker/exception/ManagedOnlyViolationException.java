package org.adcp.broker.exception;

import lombok.Getter;

@Getter
@SuppressWarnings("serial")
public class ManagedOnlyViolationException extends BrokerException {

    private final String dimension;

    public ManagedOnlyViolationException(String dimension) {
        super("Targeting dimension '%s' is managed-only and cannot be set by the buyer".formatted(dimension));
        this.dimension = dimension;
    }
}
