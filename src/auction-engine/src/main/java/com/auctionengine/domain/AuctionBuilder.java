package com.auctionengine.domain;

/**
 * Fluent builder for {@link Auction}. Unset fields fall back to
 * lots = 1, reservePrice = 0 and strategy = SINGLE_PRICE.
 */
public final class AuctionBuilder {

    public static final long DEFAULT_LOTS = 1;
    public static final long DEFAULT_RESERVE_PRICE = 0;
    public static final AuctionStrategy DEFAULT_STRATEGY = AuctionStrategy.SINGLE_PRICE;

    private long lots = DEFAULT_LOTS;
    private Long reservePrice;
    private AuctionStrategy strategy;

    public AuctionBuilder lots(long lots) {
        this.lots = lots;
        return this;
    }

    public AuctionBuilder reservePrice(long reservePrice) {
        this.reservePrice = reservePrice;
        return this;
    }

    public AuctionBuilder strategy(AuctionStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public Auction build() {
        return new Auction(
                lots,
                reservePrice != null ? reservePrice : DEFAULT_RESERVE_PRICE,
                strategy != null ? strategy : DEFAULT_STRATEGY);
    }
}
