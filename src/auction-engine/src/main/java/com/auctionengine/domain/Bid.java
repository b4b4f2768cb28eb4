package com.auctionengine.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * A request to buy {@code quantity} units at {@code amount} per unit.
 *
 * Ranking (compareTo) looks at amount only: two bids at the same price compare
 * equal and are interchangeable when ordering. Identity (equals/hashCode) is
 * the id, so distinct bids at the same price never collapse inside a set.
 * compareTo is therefore intentionally inconsistent with equals.
 */
public final class Bid implements Comparable<Bid> {

    private final UUID id;
    private final long amount;      // minor currency units, per unit
    private final long quantity;

    public Bid(UUID id, long amount, long quantity) {
        this.id = Objects.requireNonNull(id, "id");
        if (quantity < 0) {
            throw new IllegalArgumentException("Bid quantity must not be negative: " + quantity);
        }
        this.amount = amount;
        this.quantity = quantity;
    }

    /**
     * Create a bid with a freshly generated id.
     */
    public static Bid of(long amount, long quantity) {
        return new Bid(UUID.randomUUID(), amount, quantity);
    }

    /**
     * Copy of this bid reduced (or raised) to the given quantity. Keeps the id
     * so a partially filled sale still traces back to the original bid.
     */
    public Bid withQuantity(long newQuantity) {
        return new Bid(id, amount, newQuantity);
    }

    public boolean isPriceEquivalent(Bid other) {
        return amount == other.amount;
    }

    @Override
    public int compareTo(Bid other) {
        return Long.compare(this.amount, other.amount);
    }

    public UUID getId() {
        return id;
    }

    public long getAmount() {
        return amount;
    }

    public long getQuantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bid)) {
            return false;
        }
        Bid other = (Bid) o;
        return id.equals(other.id) && amount == other.amount && quantity == other.quantity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, amount, quantity);
    }

    @Override
    public String toString() {
        return "Bid{" +
                "id=" + id +
                ", amount=" + amount +
                ", quantity=" + quantity +
                '}';
    }
}
