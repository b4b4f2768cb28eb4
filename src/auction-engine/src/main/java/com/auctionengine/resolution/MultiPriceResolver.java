package com.auctionengine.resolution;

import com.auctionengine.domain.Bid;
import com.auctionengine.domain.Sale;

import java.util.ArrayList;
import java.util.List;

/**
 * Pay-as-bid auction: allocation is identical to the uniform-price auction,
 * but each winner pays its own bid amount.
 */
public class MultiPriceResolver extends GreedyAllocationResolver {

    @Override
    protected List<Sale> price(List<Bid> winners) {
        List<Sale> sales = new ArrayList<>(winners.size());
        for (Bid bid : winners) {
            sales.add(new Sale(bid.getId(), bid.getAmount(), bid.getQuantity()));
        }
        return sales;
    }
}
