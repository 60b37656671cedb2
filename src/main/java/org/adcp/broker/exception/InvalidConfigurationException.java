package org.adcp.broker.exception;

/**
 * Raised when process-level configuration (format registry, targeting classification table)
 * cannot be read or is structurally invalid. Never converted into a domain error.
 */
@SuppressWarnings("serial")
public class InvalidConfigurationException extends BrokerException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
