package com.maxmind.ipnetwork;

/**
 * Signals that an address and prefix length do not describe a network: the
 * address is not the first address of a block of that size, or the prefix
 * length is outside the range of the address family.
 */
public class InvalidNetworkException extends IpNetworkException {
    private static final long serialVersionUID = -2561478326405419838L;

    InvalidNetworkException(String message) {
        super(message);
    }
}
