package com.auctionengine.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuctionBuilderTest {

    @Test
    void defaults_apply_to_unset_fields() {
        Auction auction = Auction.builder().build();

        assertEquals(1, auction.getLots());
        assertEquals(0, auction.getReservePrice());
        assertEquals(AuctionStrategy.SINGLE_PRICE, auction.getStrategy());
    }

    @Test
    void explicit_values_override_defaults() {
        Auction auction = new AuctionBuilder()
                .lots(12)
                .reservePrice(300)
                .strategy(AuctionStrategy.MULTI_PRICE)
                .build();

        assertEquals(12, auction.getLots());
        assertEquals(300, auction.getReservePrice());
        assertEquals(AuctionStrategy.MULTI_PRICE, auction.getStrategy());
    }

    @Test
    void negative_values_are_accepted_without_validation() {
        Auction auction = Auction.builder().lots(-3).reservePrice(-50).build();

        assertEquals(-3, auction.getLots());
        assertEquals(-50, auction.getReservePrice());
        assertTrue(auction.resolveBids(List.of(Bid.of(10, 1))).isEmpty());
    }

    @Test
    void null_strategy_falls_back_to_default() {
        Auction auction = Auction.builder().strategy(null).build();

        assertEquals(AuctionStrategy.SINGLE_PRICE, auction.getStrategy());
    }

    @Test
    void auction_can_resolve_several_bid_sets_independently() {
        Auction auction = Auction.builder().lots(1).build();

        assertEquals(20, auction.resolveBids(List.of(Bid.of(20, 1))).get(0).amount());
        assertEquals(7, auction.resolveBids(List.of(Bid.of(7, 1))).get(0).amount());
        assertEquals(1, auction.getLots());
    }

    @Test
    void null_bid_collection_is_rejected() {
        Auction auction = Auction.builder().build();

        assertThrows(NullPointerException.class, () -> auction.resolveBids(null));
    }
}
