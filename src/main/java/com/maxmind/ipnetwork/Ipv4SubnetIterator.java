package com.maxmind.ipnetwork;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Instances of this class provide an iterator over the networks of a fixed
 * prefix length that tile an {@link Ipv4Network}, in ascending order. The
 * iterator is lazy and cannot be restarted.
 *
 * @see Ipv4Network#subnets(int)
 */
public final class Ipv4SubnetIterator implements Iterator<Ipv4Network> {
    private long next;
    private final long max;
    private final long stepping;
    private final int cidr;
    private Ipv4Network pending;
    private boolean exhausted;

    Ipv4SubnetIterator(Ipv4Network parent, int cidr) throws CidrMismatchException {
        if (cidr < parent.cidr() || cidr > AddressFamily.IPV4.width()) {
            throw new CidrMismatchException(
                "Cannot split " + parent + " into /" + cidr + " networks");
        }
        this.next = parent.firstValue();
        this.max = parent.lastValue();
        this.stepping = AddressFamily.IPV4.hostCount(cidr).longValueExact();
        this.cidr = cidr;
    }

    /**
     * hasNext prepares the next network. It returns false once the last
     * network inside the parent has been returned.
     *
     * @return true if there is another network.
     */
    @Override
    public boolean hasNext() {
        if (this.pending != null) {
            return true;
        }
        if (this.exhausted || this.next > this.max) {
            return false;
        }
        try {
            this.pending = Ipv4Network.of(this.next, this.cidr);
        } catch (InvalidNetworkException e) {
            // a child that cannot be built ends the sequence
            this.exhausted = true;
            return false;
        }
        this.next += this.stepping;
        return true;
    }

    /**
     * @return the next network.
     * @throws NoSuchElementException if there are no more networks.
     */
    @Override
    public Ipv4Network next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Ipv4Network network = this.pending;
        this.pending = null;
        return network;
    }

    /**
     * @return the number of networks left to return.
     */
    public long remaining() {
        long left = this.pending == null ? 0 : 1;
        if (!this.exhausted && this.next <= this.max) {
            left += (this.max - this.next + 1) / this.stepping;
        }
        return left;
    }
}
