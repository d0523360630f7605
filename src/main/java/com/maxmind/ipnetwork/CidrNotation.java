package com.maxmind.ipnetwork;

import com.google.common.net.InetAddresses;
import java.net.InetAddress;

/**
 * Splits {@code address/prefix-length} text into its two parts. Address
 * literals are parsed without any name service lookup.
 */
final class CidrNotation {
    private final String text;
    private final String addressPart;
    private final String prefixPart;

    private CidrNotation(String text, String addressPart, String prefixPart) {
        this.text = text;
        this.addressPart = addressPart;
        this.prefixPart = prefixPart;
    }

    static CidrNotation split(String text) throws NetworkParseException {
        if (text == null) {
            throw new NullPointerException("Network text cannot be null");
        }
        String[] parts = text.split("/", -1);
        if (parts.length != 2) {
            throw new NetworkParseException(
                "Expected <address>/<prefix length>, got \"" + text + "\"");
        }
        return new CidrNotation(text, parts[0], parts[1]);
    }

    /**
     * @return whether the address part is written in IPv6 notation, which
     *         includes IPv4-mapped forms such as {@code ::ffff:1.2.3.4}.
     */
    boolean isIpv6Notation() {
        return this.addressPart.indexOf(':') >= 0;
    }

    InetAddress address() throws NetworkParseException {
        try {
            return InetAddresses.forString(this.addressPart);
        } catch (IllegalArgumentException e) {
            throw new NetworkParseException(
                "\"" + this.addressPart + "\" is not an IP address in \"" + this.text + "\"", e);
        }
    }

    int prefixLength() throws NetworkParseException {
        if (this.prefixPart.isEmpty()) {
            throw new NetworkParseException("Missing prefix length in \"" + this.text + "\"");
        }
        for (int i = 0; i < this.prefixPart.length(); i++) {
            char c = this.prefixPart.charAt(i);
            if (c < '0' || c > '9') {
                throw new NetworkParseException(
                    "\"" + this.prefixPart + "\" is not a prefix length in \"" + this.text + "\"");
            }
        }
        try {
            return Integer.parseInt(this.prefixPart);
        } catch (NumberFormatException e) {
            throw new NetworkParseException(
                "\"" + this.prefixPart + "\" is not a prefix length in \"" + this.text + "\"", e);
        }
    }

    NetworkParseException wrongFamily(AddressFamily expected) {
        return new NetworkParseException(
            "\"" + this.addressPart + "\" is not an " + expected + " address in \""
                + this.text + "\"");
    }
}
