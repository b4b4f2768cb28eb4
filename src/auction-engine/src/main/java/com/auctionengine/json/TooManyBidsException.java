package com.auctionengine.json;

/**
 * Thrown when a request carries more bids than the engine accepts per request.
 */
public class TooManyBidsException extends IllegalArgumentException {

    private final int bidCount;
    private final int maxBids;

    public TooManyBidsException(int bidCount, int maxBids) {
        super("Too many bids: " + bidCount + " > " + maxBids);
        this.bidCount = bidCount;
        this.maxBids = maxBids;
    }

    public int getBidCount() {
        return bidCount;
    }

    public int getMaxBids() {
        return maxBids;
    }
}
