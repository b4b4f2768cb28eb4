package com.auctionengine.resolution;

import com.auctionengine.domain.Auction;
import com.auctionengine.domain.Bid;
import com.auctionengine.domain.Sale;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Uniform-price resolution: allocation order, partial fills, reserve cutoff
 * and the single clearing price.
 */
class SinglePriceResolverTest {

    @Test
    void returns_empty_for_no_bids() {
        Auction auction = Auction.builder().lots(10).build();

        List<Sale> sales = auction.resolveBids(List.of());

        assertTrue(sales.isEmpty());
    }

    @Test
    void all_bids_win_when_lots_cover_them_at_lowest_price() {
        Auction auction = Auction.builder().lots(10).build();

        List<Sale> sales = auction.resolveBids(List.of(Bid.of(10, 1), Bid.of(20, 1)));

        assertEquals(2, sales.size());
        assertEquals(10, sales.get(0).amount());
        assertEquals(10, sales.get(1).amount());
    }

    @Test
    void only_highest_bid_wins_a_single_lot() {
        Auction auction = Auction.builder().lots(1).build();
        Bid low = Bid.of(10, 1);
        Bid high = Bid.of(20, 1);

        List<Sale> sales = auction.resolveBids(List.of(low, high));

        assertEquals(1, sales.size());
        assertEquals(20, sales.get(0).amount());
        assertEquals(1, sales.get(0).quantity());
        assertEquals(high.getId(), sales.get(0).bidderId());
    }

    @Test
    void partially_filled_bid_sets_the_clearing_price() {
        Auction auction = Auction.builder().lots(2).build();
        Bid partial = Bid.of(10, 2);
        Bid top = Bid.of(20, 1);

        List<Sale> sales = auction.resolveBids(List.of(partial, top));

        assertEquals(2, sales.size());
        assertEquals(new Sale(top.getId(), 10, 1), sales.get(0));
        assertEquals(new Sale(partial.getId(), 10, 1), sales.get(1));
    }

    @Test
    void reserve_price_excludes_lower_bids() {
        Auction auction = Auction.builder().lots(2).reservePrice(50).build();

        List<Sale> sales = auction.resolveBids(List.of(Bid.of(55, 1), Bid.of(20, 1)));

        assertEquals(1, sales.size());
        assertEquals(55, sales.get(0).amount());
        assertEquals(1, sales.get(0).quantity());
    }

    @Test
    void bid_exactly_at_reserve_is_eligible() {
        Auction auction = Auction.builder().lots(5).reservePrice(50).build();

        List<Sale> sales = auction.resolveBids(List.of(Bid.of(50, 2), Bid.of(49, 1)));

        assertEquals(1, sales.size());
        assertEquals(50, sales.get(0).amount());
        assertEquals(2, sales.get(0).quantity());
    }

    @Test
    void no_bid_clearing_reserve_yields_empty_result() {
        Auction auction = Auction.builder().lots(5).reservePrice(100).build();

        assertTrue(auction.resolveBids(List.of(Bid.of(99, 1), Bid.of(1, 3))).isEmpty());
    }

    @Test
    void zero_lots_yields_no_sales() {
        Auction auction = Auction.builder().lots(0).build();

        assertTrue(auction.resolveBids(List.of(Bid.of(10, 1), Bid.of(20, 3))).isEmpty());
    }

    @Test
    void scan_stops_after_partial_fill_even_if_lower_bid_would_fit() {
        Auction auction = Auction.builder().lots(3).build();
        Bid top = Bid.of(30, 2);
        Bid tooBig = Bid.of(20, 5);
        Bid wouldFit = Bid.of(10, 1);

        List<Sale> sales = auction.resolveBids(List.of(wouldFit, tooBig, top));

        assertEquals(2, sales.size());
        assertEquals(new Sale(top.getId(), 20, 2), sales.get(0));
        assertEquals(new Sale(tooBig.getId(), 20, 1), sales.get(1));
    }

    @Test
    void scan_stops_when_lots_are_exhausted_exactly() {
        Auction auction = Auction.builder().lots(2).build();
        Bid a = Bid.of(30, 1);
        Bid b = Bid.of(20, 1);
        Bid c = Bid.of(10, 1);

        List<Sale> sales = auction.resolveBids(List.of(c, b, a));

        assertEquals(2, sales.size());
        assertEquals(a.getId(), sales.get(0).bidderId());
        assertEquals(b.getId(), sales.get(1).bidderId());
        assertEquals(20, sales.get(1).amount());
    }

    @Test
    void equal_amounts_keep_input_order() {
        Auction auction = Auction.builder().lots(2).build();
        Bid first = Bid.of(15, 1);
        Bid second = Bid.of(15, 1);
        Bid third = Bid.of(15, 1);

        List<Sale> sales = auction.resolveBids(List.of(first, second, third));

        assertEquals(2, sales.size());
        assertEquals(first.getId(), sales.get(0).bidderId());
        assertEquals(second.getId(), sales.get(1).bidderId());
    }

    @Test
    void zero_quantity_bid_becomes_zero_quantity_sale() {
        Auction auction = Auction.builder().lots(1).build();
        Bid empty = Bid.of(40, 0);
        Bid real = Bid.of(30, 1);

        List<Sale> sales = auction.resolveBids(List.of(real, empty));

        assertEquals(2, sales.size());
        assertEquals(new Sale(empty.getId(), 30, 0), sales.get(0));
        assertEquals(new Sale(real.getId(), 30, 1), sales.get(1));
    }

    @Test
    void negative_amounts_resolve_against_negative_reserve() {
        Auction auction = Auction.builder().lots(2).reservePrice(-10).build();

        List<Sale> sales = auction.resolveBids(List.of(Bid.of(-5, 1), Bid.of(-20, 1)));

        assertEquals(1, sales.size());
        assertEquals(-5, sales.get(0).amount());
    }

    @Test
    void input_collection_is_not_modified() {
        Auction auction = Auction.builder().lots(5).build();
        List<Bid> bids = new ArrayList<>(List.of(Bid.of(10, 1), Bid.of(30, 1), Bid.of(20, 1)));
        List<Bid> snapshot = new ArrayList<>(bids);

        auction.resolveBids(bids);

        assertEquals(snapshot, bids);
    }

    @Test
    void returned_sales_are_unmodifiable() {
        Auction auction = Auction.builder().lots(5).build();

        List<Sale> sales = auction.resolveBids(List.of(Bid.of(10, 1)));

        assertThrows(UnsupportedOperationException.class, () -> sales.add(new Sale(null, 1, 1)));
    }
}
