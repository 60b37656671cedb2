package org.adcp.broker.exception;

import lombok.Getter;

/**
 * Opaque failure reported by the ad-server collaborator. The engine wraps it without interpreting it,
 * apart from telling timeouts and cancellations from plain errors.
 */
@Getter
@SuppressWarnings("serial")
public class AdServerException extends BrokerException {

    private final boolean timeout;

    private final boolean cancelled;

    public AdServerException(String message) {
        this(message, false, false, null);
    }

    public AdServerException(String message, Throwable cause) {
        this(message, false, false, cause);
    }

    private AdServerException(String message, boolean timeout, boolean cancelled, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
        this.cancelled = cancelled;
    }

    public static AdServerException timeout(String message) {
        return new AdServerException(message, true, false, null);
    }

    public static AdServerException cancelled(String message) {
        return new AdServerException(message, false, true, null);
    }
}
