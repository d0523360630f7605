package com.maxmind.ipnetwork;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * The two IP address families and the prefix-length arithmetic for their
 * address widths. Addresses are handled as unsigned big-endian integers.
 */
public enum AddressFamily {
    /**
     * 32-bit IPv4 addresses.
     */
    IPV4(32),
    /**
     * 128-bit IPv6 addresses.
     */
    IPV6(128);

    private final int width;
    private final BigInteger maxValue;

    AddressFamily(int width) {
        this.width = width;
        this.maxValue = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    }

    /**
     * Returns the family of the address.
     *
     * @param address an IPv4 or IPv6 address.
     * @return the family of {@code address}.
     */
    public static AddressFamily of(InetAddress address) {
        if (address instanceof Inet4Address) {
            return IPV4;
        }
        if (address instanceof Inet6Address) {
            return IPV6;
        }
        throw new IllegalArgumentException(
            "Unsupported address type: " + address.getClass().getName());
    }

    /**
     * @return the number of bits in an address of this family.
     */
    public int width() {
        return this.width;
    }

    /**
     * @return the number of bytes in an address of this family.
     */
    public int byteLength() {
        return this.width / 8;
    }

    /**
     * @return the highest address value of this family, {@code 2^width - 1}.
     */
    public BigInteger maxValue() {
        return this.maxValue;
    }

    /**
     * @param cidr a prefix length.
     * @return whether {@code cidr} is within {@code [0, width]}.
     */
    public boolean isValidCidr(int cidr) {
        return cidr >= 0 && cidr <= this.width;
    }

    /**
     * Returns the number of addresses in a block with the given prefix
     * length, {@code 2^(width - cidr)}. A prefix length of 0 covers the
     * whole address space, which is one more than the family's maximum
     * address value.
     *
     * @param cidr the prefix length.
     * @return the number of addresses in the block.
     * @throws IllegalArgumentException if {@code cidr} is outside
     *         {@code [0, width]}.
     */
    public BigInteger hostCount(int cidr) {
        if (!isValidCidr(cidr)) {
            throw new IllegalArgumentException(
                "Prefix length " + cidr + " is outside [0, " + this.width + "]");
        }
        return BigInteger.ONE.shiftLeft(this.width - cidr);
    }

    /**
     * Returns whether {@code first} is the first address of a block of
     * prefix length {@code cidr}, i.e., {@code first} is a multiple of the
     * block's host count.
     *
     * @param first the candidate first address.
     * @param cidr  the prefix length.
     * @return true if {@code first/cidr} is a network of this family.
     */
    public boolean isValid(BigInteger first, int cidr) {
        if (!isValidCidr(cidr) || !isInRange(first)) {
            return false;
        }
        return first.mod(hostCount(cidr)).signum() == 0;
    }

    /**
     * Checks the same conditions as {@link #isValid(BigInteger, int)} but
     * reports the first one that fails.
     *
     * @param first the candidate first address.
     * @param cidr  the prefix length.
     * @throws InvalidNetworkException if {@code first/cidr} is not a network
     *         of this family.
     */
    void checkValid(BigInteger first, int cidr) throws InvalidNetworkException {
        if (!isValidCidr(cidr)) {
            throw new InvalidNetworkException(
                "Prefix length " + cidr + " is outside [0, " + this.width + "] for " + this);
        }
        if (!isInRange(first)) {
            throw new InvalidNetworkException(
                "Address value " + first + " is outside the " + this + " address space");
        }
        if (!isValid(first, cidr)) {
            throw new InvalidNetworkException(
                toAddress(first).getHostAddress() + " is not the first address of a /"
                    + cidr + " network");
        }
    }

    /**
     * @param address an address of this family.
     * @return the unsigned integer value of the address.
     * @throws IllegalArgumentException if the address is of the other family.
     */
    public BigInteger toValue(InetAddress address) {
        byte[] bytes = address.getAddress();
        if (bytes.length != byteLength()) {
            throw new IllegalArgumentException(
                "Expected a " + byteLength() + " byte address, got " + bytes.length
                    + " bytes: " + address);
        }
        return new BigInteger(1, bytes);
    }

    /**
     * Converts an address value back to an address. No name service is
     * consulted. IPv6 values always produce an {@link Inet6Address}, even
     * for IPv4-mapped values.
     *
     * @param value the unsigned integer value of the address.
     * @return the address.
     * @throws IllegalArgumentException if the value is outside the address
     *         space.
     */
    public InetAddress toAddress(BigInteger value) {
        if (!isInRange(value)) {
            throw new IllegalArgumentException(
                "Address value " + value + " is outside the " + this + " address space");
        }
        byte[] bytes = toBytes(value);
        try {
            return switch (this) {
                case IPV4 -> InetAddress.getByAddress(bytes);
                case IPV6 -> Inet6Address.getByAddress(null, bytes, -1);
            };
        } catch (UnknownHostException e) {
            throw new IllegalStateException(
                "Illegal network address byte length of " + bytes.length, e);
        }
    }

    private byte[] toBytes(BigInteger value) {
        // toByteArray is minimal and may carry a leading sign byte
        byte[] raw = value.toByteArray();
        byte[] bytes = new byte[byteLength()];
        int length = Math.min(raw.length, bytes.length);
        System.arraycopy(raw, raw.length - length, bytes, bytes.length - length, length);
        return bytes;
    }

    private boolean isInRange(BigInteger value) {
        return value.signum() >= 0 && value.compareTo(this.maxValue) <= 0;
    }
}
