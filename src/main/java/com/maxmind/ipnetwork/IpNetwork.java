package com.maxmind.ipnetwork;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Objects;

/**
 * {@code IpNetwork} is either an IPv4 network ({@link V4}) or an IPv6 network
 * ({@link V6}). It lets callers handle networks of both families uniformly;
 * the family-specific types stay available through the variants.
 *
 * <p>
 * IPv4 networks sort before IPv6 networks. Within a family the order is that
 * of {@link Ipv4Network} and {@link Ipv6Network}.
 * </p>
 */
public sealed interface IpNetwork extends Comparable<IpNetwork>
    permits IpNetwork.V4, IpNetwork.V6 {

    /**
     * An IPv4 network.
     *
     * @param network the IPv4 network.
     */
    record V4(Ipv4Network network) implements IpNetwork {
        public V4 {
            Objects.requireNonNull(network, "network");
        }

        @JsonValue
        @Override
        public String toString() {
            return this.network.toString();
        }
    }

    /**
     * An IPv6 network.
     *
     * @param network the IPv6 network.
     */
    record V6(Ipv6Network network) implements IpNetwork {
        public V6 {
            Objects.requireNonNull(network, "network");
        }

        @JsonValue
        @Override
        public String toString() {
            return this.network.toString();
        }
    }

    static IpNetwork of(Ipv4Network network) {
        return new V4(network);
    }

    static IpNetwork of(Ipv6Network network) {
        return new V6(network);
    }

    /**
     * @param first the first address of the network, of either family.
     * @param cidr  the prefix length.
     * @return the network.
     * @throws InvalidNetworkException if {@code first/cidr} is not a network.
     */
    static IpNetwork of(InetAddress first, int cidr) throws InvalidNetworkException {
        if (first instanceof Inet4Address v4) {
            return new V4(Ipv4Network.of(v4, cidr));
        }
        if (first instanceof Inet6Address v6) {
            return new V6(Ipv6Network.of(v6, cidr));
        }
        throw new InvalidNetworkException(
            "Unsupported address type: " + first.getClass().getName());
    }

    /**
     * Parses a network of either family in CIDR notation. Text with a
     * {@code :} in the address part is parsed as IPv6.
     *
     * @param text the network text.
     * @return the network.
     * @throws NetworkParseException   if the text is malformed.
     * @throws InvalidNetworkException if the text is well formed but does not
     *                                 describe a network.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static IpNetwork parse(String text) throws NetworkParseException, InvalidNetworkException {
        if (CidrNotation.split(text).isIpv6Notation()) {
            return new V6(Ipv6Network.parse(text));
        }
        return new V4(Ipv4Network.parse(text));
    }

    default AddressFamily family() {
        if (this instanceof V4) {
            return AddressFamily.IPV4;
        }
        return AddressFamily.IPV6;
    }

    default int cidr() {
        if (this instanceof V4 v4) {
            return v4.network().cidr();
        }
        return ((V6) this).network().cidr();
    }

    default BigInteger hostCount() {
        if (this instanceof V4 v4) {
            return BigInteger.valueOf(v4.network().hostCount());
        }
        return ((V6) this).network().hostCount();
    }

    default InetAddress first() {
        if (this instanceof V4 v4) {
            return v4.network().first();
        }
        return ((V6) this).network().first();
    }

    default InetAddress last() {
        if (this instanceof V4 v4) {
            return v4.network().last();
        }
        return ((V6) this).network().last();
    }

    default InetAddress netmask() {
        if (this instanceof V4 v4) {
            return v4.network().netmask();
        }
        return ((V6) this).network().netmask();
    }

    /**
     * @param address an address of either family.
     * @return true if the address lies strictly inside this network; always
     *         false for an address of the other family.
     */
    default boolean contains(InetAddress address) {
        if (this instanceof V4 v4 && address instanceof Inet4Address a) {
            return v4.network().contains(a);
        }
        if (this instanceof V6 v6 && address instanceof Inet6Address a) {
            return v6.network().contains(a);
        }
        return false;
    }

    /**
     * @param other a network of the same family.
     * @return true if this network encloses {@code other}.
     * @throws CidrMismatchException if the networks are of different families.
     */
    default boolean isSubnet(IpNetwork other) throws CidrMismatchException {
        if (this instanceof V4 a && other instanceof V4 b) {
            return a.network().isSubnet(b.network());
        }
        if (this instanceof V6 a && other instanceof V6 b) {
            return a.network().isSubnet(b.network());
        }
        throw familyMismatch(other);
    }

    /**
     * @param other a network of the same family.
     * @return true if {@code other} encloses this network.
     * @throws CidrMismatchException if the networks are of different families.
     */
    default boolean isSupernet(IpNetwork other) throws CidrMismatchException {
        if (this instanceof V4 a && other instanceof V4 b) {
            return a.network().isSupernet(b.network());
        }
        if (this instanceof V6 a && other instanceof V6 b) {
            return a.network().isSupernet(b.network());
        }
        throw familyMismatch(other);
    }

    @Override
    default int compareTo(IpNetwork other) {
        if (this instanceof V4 a && other instanceof V4 b) {
            return a.network().compareTo(b.network());
        }
        if (this instanceof V6 a && other instanceof V6 b) {
            return a.network().compareTo(b.network());
        }
        return this instanceof V4 ? -1 : 1;
    }

    private CidrMismatchException familyMismatch(IpNetwork other) {
        return new CidrMismatchException(
            "Cannot compare " + family() + " network " + this + " with " + other.family()
                + " network " + other);
    }
}
