package com.maxmind.ipnetwork;

/**
 * Signals that two operands cannot be combined because their address
 * families or prefix lengths are inconsistent, e.g., testing an IPv4 network
 * against an IPv6 network, or splitting a network into blocks larger than
 * itself.
 */
public class CidrMismatchException extends IpNetworkException {
    private static final long serialVersionUID = 7390254166183750211L;

    CidrMismatchException(String message) {
        super(message);
    }
}
