package com.auctionengine.resolution;

import com.auctionengine.domain.Auction;
import com.auctionengine.domain.Bid;
import com.auctionengine.domain.Sale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Shared allocation pass for the sealed-bid strategies.
 *
 * Price priority: bids are ranked by amount, highest first.
 * Arrival priority: bids at the same amount keep their input order
 * (List.sort is stable).
 *
 * The scan stops at the first bid below the reserve, after the first partial
 * fill, or once no lots remain. Subclasses decide what each winner pays.
 *
 * Time complexity: O(B log B) where B = bids.
 */
public abstract class GreedyAllocationResolver implements ResolutionAlgorithm {

    private static final Logger logger = LoggerFactory.getLogger(GreedyAllocationResolver.class);

    @Override
    public final List<Sale> resolve(Auction auction, Collection<Bid> bids) {
        List<Bid> winners = allocate(auction, bids);
        if (winners.isEmpty()) {
            logger.debug("No winning bids: {} bids, {}", bids.size(), auction);
            return Collections.emptyList();
        }
        List<Sale> sales = price(winners);
        logger.debug("Resolved {} bids into {} sales: {}", bids.size(), sales.size(), auction);
        return Collections.unmodifiableList(sales);
    }

    /**
     * Select the winning bids in acceptance order. A partially filled winner
     * appears as a copy carrying the awarded quantity. The copy keeps the
     * submitted bid's id instead of minting a fresh one, so every sale traces
     * back to a bid the caller submitted.
     */
    static List<Bid> allocate(Auction auction, Collection<Bid> bids) {
        List<Bid> ranked = new ArrayList<>(bids);
        ranked.sort(Comparator.reverseOrder());

        long remainingLots = auction.getLots();
        List<Bid> winners = new ArrayList<>();
        for (Bid bid : ranked) {
            if (bid.getAmount() < auction.getReservePrice()) {
                break;  // everything after is ranked no higher
            }
            if (bid.getQuantity() <= remainingLots) {
                remainingLots -= bid.getQuantity();
                winners.add(bid);
            } else if (remainingLots > 0) {
                winners.add(bid.withQuantity(remainingLots));
                remainingLots = 0;
                break;
            } else {
                break;
            }
        }
        return winners;
    }

    /**
     * Turn the non-empty, ordered list of winners into sales.
     */
    protected abstract List<Sale> price(List<Bid> winners);
}
