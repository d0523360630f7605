package com.maxmind.ipnetwork;

/**
 * Signals that a string is not in {@code address/prefix-length} notation.
 */
public class NetworkParseException extends IpNetworkException {
    private static final long serialVersionUID = -5030519735206624781L;

    NetworkParseException(String message) {
        super(message);
    }

    NetworkParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
