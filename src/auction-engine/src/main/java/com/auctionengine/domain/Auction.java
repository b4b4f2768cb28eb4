package com.auctionengine.domain;

import com.auctionengine.resolution.MultiPriceResolver;
import com.auctionengine.resolution.ResolutionAlgorithm;
import com.auctionengine.resolution.SinglePriceResolver;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration for resolving bids: the number of lots on offer,
 * the reserve price and the pricing strategy. One Auction can resolve any
 * number of bid sets; resolutions share no state.
 *
 * Values are not validated. Negative lots or reserve prices are accepted and
 * resolve deterministically, though not meaningfully.
 */
public final class Auction {

    private static final ResolutionAlgorithm SINGLE_PRICE_RESOLVER = new SinglePriceResolver();
    private static final ResolutionAlgorithm MULTI_PRICE_RESOLVER = new MultiPriceResolver();

    private final long lots;
    private final long reservePrice;
    private final AuctionStrategy strategy;

    Auction(long lots, long reservePrice, AuctionStrategy strategy) {
        this.lots = lots;
        this.reservePrice = reservePrice;
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public static AuctionBuilder builder() {
        return new AuctionBuilder();
    }

    /**
     * Resolve the given bids into sales according to this auction's strategy.
     * The collection is copied, never modified. Sales come back in acceptance
     * order, highest bid first.
     */
    public List<Sale> resolveBids(Collection<Bid> bids) {
        Objects.requireNonNull(bids, "bids");
        return algorithm().resolve(this, bids);
    }

    private ResolutionAlgorithm algorithm() {
        return switch (strategy) {
            case SINGLE_PRICE -> SINGLE_PRICE_RESOLVER;
            case MULTI_PRICE -> MULTI_PRICE_RESOLVER;
        };
    }

    public long getLots() {
        return lots;
    }

    public long getReservePrice() {
        return reservePrice;
    }

    public AuctionStrategy getStrategy() {
        return strategy;
    }

    @Override
    public String toString() {
        return "Auction{" +
                "lots=" + lots +
                ", reservePrice=" + reservePrice +
                ", strategy=" + strategy +
                '}';
    }
}
