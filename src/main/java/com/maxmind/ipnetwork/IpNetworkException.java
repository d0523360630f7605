package com.maxmind.ipnetwork;

/**
 * This class represents a generic IP network error. All other checked
 * exceptions thrown by this library subclass this exception, one subclass per
 * kind of failure.
 */
public abstract class IpNetworkException extends Exception {
    private static final long serialVersionUID = 4208236513547103296L;

    IpNetworkException(String message) {
        super(message);
    }

    IpNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
