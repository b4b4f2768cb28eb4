package com.auctionengine.domain;

import java.util.UUID;

/**
 * Outcome for one winning bid: the price charged per unit and the units
 * actually awarded. {@code bidderId} is the id of the winning bid.
 */
public record Sale(UUID bidderId, long amount, long quantity) {}
