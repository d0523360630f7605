package com.maxmind.ipnetwork;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;

/**
 * {@code Ipv4Network} represents an IPv4 network: a first address and a
 * prefix length, where the first address is aligned to the size of the
 * block. Instances are immutable.
 *
 * <p>
 * Networks are ordered by first address and then by prefix length, so a
 * network sorts before the more specific networks that share its first
 * address.
 * </p>
 */
public final class Ipv4Network implements Comparable<Ipv4Network> {
    /**
     * The highest IPv4 address value, also the all-ones netmask.
     */
    public static final long MAX_NETMASK = 0xFFFF_FFFFL;

    private final long first;
    private final int cidr;

    private Ipv4Network(long first, int cidr) {
        this.first = first;
        this.cidr = cidr;
    }

    /**
     * Creates a network from the four octets of its first address.
     *
     * @param a    the first octet.
     * @param b    the second octet.
     * @param c    the third octet.
     * @param d    the fourth octet.
     * @param cidr the prefix length.
     * @return the network.
     * @throws InvalidNetworkException if an octet is outside {@code [0, 255]},
     *         the prefix length is outside {@code [0, 32]}, or the address is
     *         not the first address of a block of that prefix length.
     */
    public static Ipv4Network of(int a, int b, int c, int d, int cidr)
        throws InvalidNetworkException {
        long first = 0;
        for (int octet : new int[] {a, b, c, d}) {
            if (octet < 0 || octet > 0xFF) {
                throw new InvalidNetworkException("Octet " + octet + " is outside [0, 255]");
            }
            first = (first << 8) | octet;
        }
        return of(first, cidr);
    }

    /**
     * Creates a network from the numeric value of its first address.
     *
     * @param first the first address as an unsigned 32-bit value.
     * @param cidr  the prefix length.
     * @return the network.
     * @throws InvalidNetworkException if {@code first/cidr} is not an IPv4
     *         network.
     */
    public static Ipv4Network of(long first, int cidr) throws InvalidNetworkException {
        AddressFamily.IPV4.checkValid(BigInteger.valueOf(first), cidr);
        return new Ipv4Network(first, cidr);
    }

    /**
     * @param first the first address of the network.
     * @param cidr  the prefix length.
     * @return the network.
     * @throws InvalidNetworkException if {@code first/cidr} is not an IPv4
     *         network.
     */
    public static Ipv4Network of(Inet4Address first, int cidr) throws InvalidNetworkException {
        return of(AddressFamily.IPV4.toValue(first).longValue(), cidr);
    }

    /**
     * Parses a network in CIDR notation, e.g., {@code 1.1.1.0/24}.
     *
     * @param text the network text.
     * @return the network.
     * @throws NetworkParseException   if the text is not an IPv4 address and a
     *                                 decimal prefix length separated by a
     *                                 single {@code /}.
     * @throws InvalidNetworkException if the text is well formed but does not
     *                                 describe a network.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Ipv4Network parse(String text)
        throws NetworkParseException, InvalidNetworkException {
        CidrNotation notation = CidrNotation.split(text);
        if (notation.isIpv6Notation()) {
            throw notation.wrongFamily(AddressFamily.IPV4);
        }
        InetAddress address = notation.address();
        if (!(address instanceof Inet4Address)) {
            throw notation.wrongFamily(AddressFamily.IPV4);
        }
        return of((Inet4Address) address, notation.prefixLength());
    }

    /**
     * @return the prefix length.
     */
    public int cidr() {
        return this.cidr;
    }

    /**
     * @return the number of addresses in the network, including its first and
     *         last address. A {@code /0} network has {@code 2^32} addresses.
     */
    public long hostCount() {
        return AddressFamily.IPV4.hostCount(this.cidr).longValueExact();
    }

    /**
     * @return the first address as an unsigned 32-bit value.
     */
    public long firstValue() {
        return this.first;
    }

    /**
     * @return the last address as an unsigned 32-bit value.
     */
    public long lastValue() {
        return this.first + hostCount() - 1;
    }

    /**
     * @return the first address of the network.
     */
    public Inet4Address first() {
        return toAddress(this.first);
    }

    /**
     * @return the last address of the network.
     */
    public Inet4Address last() {
        return toAddress(lastValue());
    }

    /**
     * @return the netmask, e.g., {@code 255.255.255.0} for a {@code /24}.
     */
    public Inet4Address netmask() {
        return toAddress(MAX_NETMASK ^ (hostCount() - 1));
    }

    /**
     * Returns whether the address lies strictly inside the network. The
     * network's own first and last address are not contained.
     *
     * @param address the address to test.
     * @return true if {@code first < address < last}.
     */
    public boolean contains(Inet4Address address) {
        long value = AddressFamily.IPV4.toValue(address).longValue();
        return value > this.first && value < lastValue();
    }

    /**
     * @param other another network.
     * @return true if this network encloses {@code other}; a network encloses
     *         itself.
     */
    public boolean isSubnet(Ipv4Network other) {
        return this.first <= other.first && other.lastValue() <= lastValue();
    }

    /**
     * @param other another network.
     * @return true if {@code other} encloses this network; a network is
     *         enclosed by itself.
     */
    public boolean isSupernet(Ipv4Network other) {
        return this.first >= other.first && other.lastValue() >= lastValue();
    }

    /**
     * Returns an iterator over the networks of prefix length {@code newCidr}
     * that make up this network, in ascending order.
     *
     * @param newCidr the prefix length of the returned networks.
     * @return the iterator.
     * @throws CidrMismatchException if {@code newCidr} is shorter than this
     *         network's prefix length or longer than 32.
     */
    public Ipv4SubnetIterator subnets(int newCidr) throws CidrMismatchException {
        return new Ipv4SubnetIterator(this, newCidr);
    }

    /**
     * Returns an iterator over the addresses that this network
     * {@linkplain #contains(Inet4Address) contains}: every address but the
     * first and the last.
     *
     * @return the iterator.
     */
    public HostIterator<Inet4Address> hosts() {
        return new HostIterator<>(
            AddressFamily.IPV4,
            Inet4Address.class,
            BigInteger.valueOf(this.first + 1),
            BigInteger.valueOf(lastValue() - 1));
    }

    private static Inet4Address toAddress(long value) {
        return (Inet4Address) AddressFamily.IPV4.toAddress(BigInteger.valueOf(value));
    }

    @Override
    public int compareTo(Ipv4Network other) {
        int order = Long.compare(this.first, other.first);
        if (order != 0) {
            return order;
        }
        return Integer.compare(this.cidr, other.cidr);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ipv4Network)) {
            return false;
        }
        Ipv4Network other = (Ipv4Network) o;
        return this.first == other.first && this.cidr == other.cidr;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(this.first) + this.cidr;
    }

    /**
     * @return the network in CIDR notation, e.g., {@code 1.1.1.0/24}.
     */
    @JsonValue
    @Override
    public String toString() {
        return first().getHostAddress() + "/" + this.cidr;
    }
}
