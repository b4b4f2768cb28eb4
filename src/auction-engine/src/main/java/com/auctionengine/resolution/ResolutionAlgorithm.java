package com.auctionengine.resolution;

import com.auctionengine.domain.Auction;
import com.auctionengine.domain.Bid;
import com.auctionengine.domain.Sale;

import java.util.Collection;
import java.util.List;

/**
 * Interface for auction resolution algorithms.
 * The algorithm takes the auction configuration and the submitted bids,
 * and returns the sales produced, highest bid first.
 */
public interface ResolutionAlgorithm {
    List<Sale> resolve(Auction auction, Collection<Bid> bids);
}
