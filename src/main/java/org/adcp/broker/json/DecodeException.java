package org.adcp.broker.json;

@SuppressWarnings("serial")
public class DecodeException extends RuntimeException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
