package com.maxmind.ipnetwork;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.net.InetAddresses;
import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * {@code Ipv6Network} represents an IPv6 network: a first address and a
 * prefix length, where the first address is aligned to the size of the
 * block. Instances are immutable.
 *
 * @see Ipv4Network
 */
public final class Ipv6Network implements Comparable<Ipv6Network> {
    /**
     * The highest IPv6 address value, also the all-ones netmask.
     */
    public static final BigInteger MAX_NETMASK = AddressFamily.IPV6.maxValue();

    // ::ffff:0:0/96
    private static final BigInteger IPV4_MAPPED_PREFIX = BigInteger.valueOf(0xFFFFL).shiftLeft(32);

    private final BigInteger first;
    private final int cidr;

    private Ipv6Network(BigInteger first, int cidr) {
        this.first = first;
        this.cidr = cidr;
    }

    /**
     * Creates a network from the numeric value of its first address.
     *
     * @param first the first address as an unsigned 128-bit value.
     * @param cidr  the prefix length.
     * @return the network.
     * @throws InvalidNetworkException if the prefix length is outside
     *         {@code [0, 128]}, the value is outside the address space, or
     *         the address is not the first address of a block of that prefix
     *         length.
     */
    public static Ipv6Network of(BigInteger first, int cidr) throws InvalidNetworkException {
        if (first == null) {
            throw new NullPointerException("First address cannot be null");
        }
        AddressFamily.IPV6.checkValid(first, cidr);
        return new Ipv6Network(first, cidr);
    }

    /**
     * @param first the first address of the network.
     * @param cidr  the prefix length.
     * @return the network.
     * @throws InvalidNetworkException if {@code first/cidr} is not an IPv6
     *         network.
     */
    public static Ipv6Network of(Inet6Address first, int cidr) throws InvalidNetworkException {
        return of(AddressFamily.IPV6.toValue(first), cidr);
    }

    /**
     * Parses a network in CIDR notation, e.g., {@code 2001:db8::/32}.
     * IPv4-mapped addresses such as {@code ::ffff:10.0.0.0/104} are kept in
     * the IPv6 address space.
     *
     * @param text the network text.
     * @return the network.
     * @throws NetworkParseException   if the text is not an IPv6 address and a
     *                                 decimal prefix length separated by a
     *                                 single {@code /}.
     * @throws InvalidNetworkException if the text is well formed but does not
     *                                 describe a network.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Ipv6Network parse(String text)
        throws NetworkParseException, InvalidNetworkException {
        CidrNotation notation = CidrNotation.split(text);
        if (!notation.isIpv6Notation()) {
            throw notation.wrongFamily(AddressFamily.IPV6);
        }
        InetAddress address = notation.address();
        BigInteger value;
        if (address instanceof Inet4Address) {
            // the address parser collapses ::ffff:a.b.c.d to a.b.c.d
            value = IPV4_MAPPED_PREFIX.or(AddressFamily.IPV4.toValue(address));
        } else {
            value = AddressFamily.IPV6.toValue(address);
        }
        return of(value, notation.prefixLength());
    }

    /**
     * @return the prefix length.
     */
    public int cidr() {
        return this.cidr;
    }

    /**
     * @return the number of addresses in the network, including its first and
     *         last address.
     */
    public BigInteger hostCount() {
        return AddressFamily.IPV6.hostCount(this.cidr);
    }

    /**
     * @return the first address as an unsigned 128-bit value.
     */
    public BigInteger firstValue() {
        return this.first;
    }

    /**
     * @return the last address as an unsigned 128-bit value.
     */
    public BigInteger lastValue() {
        return this.first.add(hostCount()).subtract(BigInteger.ONE);
    }

    /**
     * @return the first address of the network.
     */
    public Inet6Address first() {
        return toAddress(this.first);
    }

    /**
     * @return the last address of the network.
     */
    public Inet6Address last() {
        return toAddress(lastValue());
    }

    /**
     * @return the netmask, e.g., {@code ffff:ffff::} for a {@code /32}.
     */
    public Inet6Address netmask() {
        return toAddress(MAX_NETMASK.xor(hostCount().subtract(BigInteger.ONE)));
    }

    /**
     * Returns whether the address lies strictly inside the network. The
     * network's own first and last address are not contained.
     *
     * @param address the address to test.
     * @return true if {@code first < address < last}.
     */
    public boolean contains(Inet6Address address) {
        BigInteger value = AddressFamily.IPV6.toValue(address);
        return value.compareTo(this.first) > 0 && value.compareTo(lastValue()) < 0;
    }

    /**
     * @param other another network.
     * @return true if this network encloses {@code other}.
     */
    public boolean isSubnet(Ipv6Network other) {
        return this.first.compareTo(other.first) <= 0
            && other.lastValue().compareTo(lastValue()) <= 0;
    }

    /**
     * @param other another network.
     * @return true if {@code other} encloses this network.
     */
    public boolean isSupernet(Ipv6Network other) {
        return this.first.compareTo(other.first) >= 0
            && other.lastValue().compareTo(lastValue()) >= 0;
    }

    /**
     * Returns an iterator over the networks of prefix length {@code newCidr}
     * that make up this network, in ascending order.
     *
     * @param newCidr the prefix length of the returned networks.
     * @return the iterator.
     * @throws CidrMismatchException if {@code newCidr} is shorter than this
     *         network's prefix length or longer than 128.
     */
    public Ipv6SubnetIterator subnets(int newCidr) throws CidrMismatchException {
        return new Ipv6SubnetIterator(this, newCidr);
    }

    /**
     * Returns an iterator over every address of the network but the first
     * and the last.
     *
     * @return the iterator.
     */
    public HostIterator<Inet6Address> hosts() {
        return new HostIterator<>(
            AddressFamily.IPV6,
            Inet6Address.class,
            this.first.add(BigInteger.ONE),
            lastValue().subtract(BigInteger.ONE));
    }

    private static Inet6Address toAddress(BigInteger value) {
        return (Inet6Address) AddressFamily.IPV6.toAddress(value);
    }

    @Override
    public int compareTo(Ipv6Network other) {
        int order = this.first.compareTo(other.first);
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
        if (!(o instanceof Ipv6Network)) {
            return false;
        }
        Ipv6Network other = (Ipv6Network) o;
        return this.first.equals(other.first) && this.cidr == other.cidr;
    }

    @Override
    public int hashCode() {
        return 31 * this.first.hashCode() + this.cidr;
    }

    /**
     * @return the network in CIDR notation with the address in its
     *         shortest form, e.g., {@code 2001:db8::/32}.
     */
    @JsonValue
    @Override
    public String toString() {
        return InetAddresses.toAddrString(first()) + "/" + this.cidr;
    }
}
