package com.spirecomm.bridge.protocol;

/**
 * A bridge response body that could not be decoded into the expected shape.
 */
public final class BridgeProtocolException extends Exception {
    public BridgeProtocolException(String message) {
        super(message);
    }

    public BridgeProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
