package com.auctionengine.logging;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters shared between the HTTP threads (writers) and the
 * periodic stats logger thread (reader).
 */
public class ResolutionStats {

    public final AtomicLong resolutions = new AtomicLong();
    public final AtomicLong bidsReceived = new AtomicLong();
    public final AtomicLong sales = new AtomicLong();
    public final AtomicLong lotsAwarded = new AtomicLong();
    public final AtomicLong requestsRejected = new AtomicLong();
}
