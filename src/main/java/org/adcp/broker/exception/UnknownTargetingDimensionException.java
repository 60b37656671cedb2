package org.adcp.broker.exception;

import lombok.Getter;

import java.util.List;

@Getter
@SuppressWarnings("serial")
public class UnknownTargetingDimensionException extends BrokerException {

    private final List<String> dimensions;

    public UnknownTargetingDimensionException(List<String> dimensions) {
        super("Unknown targeting dimension(s): " + String.join(", ", dimensions));
        this.dimensions = List.copyOf(dimensions);
    }
}
