package com.maxmind.ipnetwork;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import org.junit.jupiter.api.Test;

public class AddressFamilyTest {
    @Test
    public void testHostCount() {
        assertEquals(BigInteger.valueOf(256), AddressFamily.IPV4.hostCount(24));
        assertEquals(BigInteger.valueOf(128), AddressFamily.IPV4.hostCount(25));
        assertEquals(BigInteger.ONE, AddressFamily.IPV4.hostCount(32));
        assertEquals(BigInteger.ONE, AddressFamily.IPV6.hostCount(128));
        assertEquals(BigInteger.ONE.shiftLeft(64), AddressFamily.IPV6.hostCount(64));
    }

    @Test
    public void testHostCountOfWholeAddressSpace() {
        assertEquals(BigInteger.ONE.shiftLeft(32), AddressFamily.IPV4.hostCount(0));
        assertEquals(BigInteger.ONE.shiftLeft(128), AddressFamily.IPV6.hostCount(0));
        assertEquals(AddressFamily.IPV4.maxValue().add(BigInteger.ONE), AddressFamily.IPV4.hostCount(0));
    }

    @Test
    public void testHostCountRejectsPrefixLengthOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> AddressFamily.IPV4.hostCount(33));
        assertThrows(IllegalArgumentException.class, () -> AddressFamily.IPV6.hostCount(-1));
    }

    @Test
    public void testIsValid() {
        assertTrue(AddressFamily.IPV4.isValid(BigInteger.valueOf(16843008), 24));
        assertFalse(AddressFamily.IPV4.isValid(BigInteger.valueOf(16843008), 23));
        assertTrue(AddressFamily.IPV4.isValid(BigInteger.ZERO, 0));
        assertTrue(AddressFamily.IPV4.isValid(BigInteger.valueOf(7), 32));
        assertFalse(AddressFamily.IPV4.isValid(BigInteger.ONE.shiftLeft(32), 32));
        assertFalse(AddressFamily.IPV4.isValid(BigInteger.ZERO, 33));
        assertTrue(AddressFamily.IPV6.isValid(BigInteger.ONE.shiftLeft(127), 1));
        assertFalse(AddressFamily.IPV6.isValid(BigInteger.ONE.shiftLeft(127), 0));
    }

    @Test
    public void testWidths() {
        assertEquals(32, AddressFamily.IPV4.width());
        assertEquals(4, AddressFamily.IPV4.byteLength());
        assertEquals(128, AddressFamily.IPV6.width());
        assertEquals(16, AddressFamily.IPV6.byteLength());
        assertEquals(BigInteger.valueOf(0xFFFFFFFFL), AddressFamily.IPV4.maxValue());
    }

    @Test
    public void testOf() throws Exception {
        assertEquals(AddressFamily.IPV4, AddressFamily.of(InetAddress.getByName("1.2.3.4")));
        assertEquals(AddressFamily.IPV6, AddressFamily.of(InetAddress.getByName("::1")));
    }

    @Test
    public void testToValue() throws Exception {
        assertEquals(BigInteger.valueOf(0xFFFFFFFFL),
            AddressFamily.IPV4.toValue(InetAddress.getByName("255.255.255.255")));
        assertEquals(BigInteger.ONE, AddressFamily.IPV6.toValue(InetAddress.getByName("::1")));
        assertThrows(IllegalArgumentException.class,
            () -> AddressFamily.IPV6.toValue(InetAddress.getByName("1.2.3.4")));
    }

    @Test
    public void testToAddress() throws Exception {
        InetAddress v4 = AddressFamily.IPV4.toAddress(BigInteger.valueOf(0x80000001L));
        assertTrue(v4 instanceof Inet4Address);
        assertArrayEquals(new byte[] {(byte) 0x80, 0, 0, 1}, v4.getAddress());

        InetAddress v6 = AddressFamily.IPV6.toAddress(AddressFamily.IPV6.maxValue());
        assertTrue(v6 instanceof Inet6Address);
        assertEquals(InetAddress.getByName("ffff:ffff:ffff:ffff:ffff:ffff:ffff:ffff"), v6);

        assertEquals(InetAddress.getByName("0.0.0.0"), AddressFamily.IPV4.toAddress(BigInteger.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> AddressFamily.IPV4.toAddress(BigInteger.ONE.shiftLeft(32)));
    }

    @Test
    public void testToAddressKeepsMappedValuesIpv6() {
        InetAddress mapped = AddressFamily.IPV6.toAddress(new BigInteger("ffff01020304", 16));

        assertTrue(mapped instanceof Inet6Address);
        assertEquals(16, mapped.getAddress().length);
    }
}
