package com.hubbridge.protocol;

/**
 * Failure reported by the protocol engine (server start, port binding, endpoint attach).
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
