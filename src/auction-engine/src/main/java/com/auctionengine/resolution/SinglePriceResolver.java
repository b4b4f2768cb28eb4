package com.auctionengine.resolution;

import com.auctionengine.domain.Bid;
import com.auctionengine.domain.Sale;

import java.util.ArrayList;
import java.util.List;

/**
 * Uniform-price auction: every winner pays the clearing price, which is the
 * amount of the last (lowest) accepted bid.
 */
public class SinglePriceResolver extends GreedyAllocationResolver {

    @Override
    protected List<Sale> price(List<Bid> winners) {
        long clearingPrice = winners.get(winners.size() - 1).getAmount();
        List<Sale> sales = new ArrayList<>(winners.size());
        for (Bid bid : winners) {
            sales.add(new Sale(bid.getId(), clearingPrice, bid.getQuantity()));
        }
        return sales;
    }
}
