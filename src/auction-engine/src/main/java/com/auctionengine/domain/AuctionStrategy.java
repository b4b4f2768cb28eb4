package com.auctionengine.domain;

import java.util.Locale;

/**
 * Pricing rule used when an auction is resolved.
 */
public enum AuctionStrategy {
    /** Every winner pays the lowest winning bid's amount. */
    SINGLE_PRICE,
    /** Every winner pays its own bid amount (pay-as-bid). */
    MULTI_PRICE;

    /**
     * Lenient parse accepting "SINGLE_PRICE", "single-price" and "SinglePrice".
     */
    public static AuctionStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Strategy must not be empty");
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return AuctionStrategy.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown strategy: " + value, e);
        }
    }
}
