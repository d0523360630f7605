package com.maxmind.ipnetwork;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Instances of this class provide an iterator over a range of consecutive
 * addresses, in ascending order. Networks hand out the addresses they
 * {@linkplain Ipv4Network#contains(java.net.Inet4Address) contain}, so the
 * first and last address of the network are never returned. Only the
 * cursor is held in memory.
 *
 * @param <A> the address type returned by the iterator.
 */
public final class HostIterator<A extends InetAddress> implements Iterator<A> {
    private final AddressFamily family;
    private final Class<A> type;
    private BigInteger next;
    private final BigInteger max;

    /**
     * Constructs a HostIterator.
     *
     * @param family The family of the addresses.
     * @param type   The address type returned by the iterator.
     * @param next   The value of the first address to return.
     * @param max    The value of the last address to return. A value below
     *               {@code next} gives an empty iterator.
     */
    HostIterator(AddressFamily family, Class<A> type, BigInteger next, BigInteger max) {
        this.family = family;
        this.type = type;
        this.next = next;
        this.max = max;
    }

    @Override
    public boolean hasNext() {
        return this.next.compareTo(this.max) <= 0;
    }

    /**
     * @return the next address.
     * @throws NoSuchElementException if there are no more addresses.
     */
    @Override
    public A next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        A address = this.type.cast(this.family.toAddress(this.next));
        this.next = this.next.add(BigInteger.ONE);
        return address;
    }

    /**
     * @return the number of addresses left to return.
     */
    public BigInteger remaining() {
        if (!hasNext()) {
            return BigInteger.ZERO;
        }
        return this.max.subtract(this.next).add(BigInteger.ONE);
    }
}
