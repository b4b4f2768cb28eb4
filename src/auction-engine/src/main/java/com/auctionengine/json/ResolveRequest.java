package com.auctionengine.json;

import com.auctionengine.domain.Auction;
import com.auctionengine.domain.Bid;

import java.util.List;

/**
 * A decoded resolve request: the auction to run and the bids to run it over.
 */
public record ResolveRequest(Auction auction, List<Bid> bids) {}
