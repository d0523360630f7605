package com.maxmind.ipnetwork;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class HostIteratorTest {
    private static List<String> hosts(HostIterator<?> iterator) {
        List<String> hosts = new ArrayList<>();
        while (iterator.hasNext()) {
            hosts.add(iterator.next().getHostAddress());
        }
        return hosts;
    }

    @Test
    public void testExcludesFirstAndLastAddress() throws IpNetworkException {
        Ipv4Network network = Ipv4Network.parse("1.1.1.0/30");

        assertEquals(List.of("1.1.1.1", "1.1.1.2"), hosts(network.hosts()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.1.1.1/32", "1.1.1.0/31", "0.0.0.0/32", "255.255.255.255/32"})
    public void testTinyNetworksHaveNoHosts(String text) throws IpNetworkException {
        HostIterator<Inet4Address> hosts = Ipv4Network.parse(text).hosts();

        assertFalse(hosts.hasNext());
        assertEquals(BigInteger.ZERO, hosts.remaining());
        assertThrows(NoSuchElementException.class, hosts::next);
    }

    @Test
    public void testHostsAreExactlyTheContainedAddresses() throws Exception {
        Ipv4Network network = Ipv4Network.parse("192.168.10.0/24");
        Ipv4Network wider = Ipv4Network.parse("192.168.0.0/16");

        List<String> hosts = hosts(network.hosts());
        assertEquals(254, hosts.size());

        int contained = 0;
        HostIterator<Inet4Address> candidates = wider.hosts();
        while (candidates.hasNext()) {
            Inet4Address candidate = candidates.next();
            if (network.contains(candidate)) {
                contained++;
                assertTrue(hosts.contains(candidate.getHostAddress()));
            }
        }
        assertEquals(hosts.size(), contained);
    }

    @Test
    public void testRemaining() throws IpNetworkException {
        HostIterator<Inet4Address> hosts = Ipv4Network.parse("10.0.0.0/24").hosts();

        assertEquals(BigInteger.valueOf(254), hosts.remaining());
        hosts.next();
        assertEquals(BigInteger.valueOf(253), hosts.remaining());
    }

    @Test
    public void testWholeAddressSpaceIsLazy() throws Exception {
        HostIterator<Inet4Address> hosts = Ipv4Network.parse("0.0.0.0/0").hosts();

        assertEquals(BigInteger.valueOf((1L << 32) - 2), hosts.remaining());
        assertEquals(InetAddress.getByName("0.0.0.1"), hosts.next());
        assertEquals(InetAddress.getByName("0.0.0.2"), hosts.next());
    }

    @Test
    public void testIpv6Hosts() throws Exception {
        HostIterator<Inet6Address> hosts = Ipv6Network.parse("2001:db8::/126").hosts();

        assertEquals(InetAddress.getByName("2001:db8::1"), hosts.next());
        assertEquals(InetAddress.getByName("2001:db8::2"), hosts.next());
        assertFalse(hosts.hasNext());
    }

    @Test
    public void testIpv4MappedHostsStayIpv6() throws IpNetworkException {
        HostIterator<Inet6Address> hosts = Ipv6Network.parse("::ffff:10.0.0.0/126").hosts();

        Inet6Address host = hosts.next();
        assertEquals(new BigInteger("ffff0a000001", 16), AddressFamily.IPV6.toValue(host));
    }

    @Test
    public void testIpv6WholeAddressSpace() throws IpNetworkException {
        HostIterator<Inet6Address> hosts = Ipv6Network.parse("::/0").hosts();

        assertEquals(BigInteger.ONE.shiftLeft(128).subtract(BigInteger.TWO), hosts.remaining());
        assertTrue(hosts.hasNext());
    }
}
