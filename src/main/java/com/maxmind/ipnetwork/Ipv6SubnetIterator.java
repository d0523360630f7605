package com.maxmind.ipnetwork;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Instances of this class provide an iterator over the networks of a fixed
 * prefix length that tile an {@link Ipv6Network}, in ascending order. The
 * iterator is lazy, so splitting a large network into {@code /128}s is
 * possible as long as the caller stops early.
 *
 * @see Ipv6Network#subnets(int)
 */
public final class Ipv6SubnetIterator implements Iterator<Ipv6Network> {
    private BigInteger next;
    private final BigInteger max;
    private final BigInteger stepping;
    private final int cidr;
    private Ipv6Network pending;
    private boolean exhausted;

    Ipv6SubnetIterator(Ipv6Network parent, int cidr) throws CidrMismatchException {
        if (cidr < parent.cidr() || cidr > AddressFamily.IPV6.width()) {
            throw new CidrMismatchException(
                "Cannot split " + parent + " into /" + cidr + " networks");
        }
        this.next = parent.firstValue();
        this.max = parent.lastValue();
        this.stepping = AddressFamily.IPV6.hostCount(cidr);
        this.cidr = cidr;
    }

    @Override
    public boolean hasNext() {
        if (this.pending != null) {
            return true;
        }
        if (this.exhausted || this.next.compareTo(this.max) > 0) {
            return false;
        }
        try {
            this.pending = Ipv6Network.of(this.next, this.cidr);
        } catch (InvalidNetworkException e) {
            // a child that cannot be built ends the sequence
            this.exhausted = true;
            return false;
        }
        this.next = this.next.add(this.stepping);
        return true;
    }

    @Override
    public Ipv6Network next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Ipv6Network network = this.pending;
        this.pending = null;
        return network;
    }

    /**
     * @return the number of networks left to return.
     */
    public BigInteger remaining() {
        BigInteger left = this.pending == null ? BigInteger.ZERO : BigInteger.ONE;
        if (!this.exhausted && this.next.compareTo(this.max) <= 0) {
            left = left.add(this.max.subtract(this.next).add(BigInteger.ONE).divide(this.stepping));
        }
        return left;
    }
}
