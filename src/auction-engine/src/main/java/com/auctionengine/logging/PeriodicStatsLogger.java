package com.auctionengine.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs aggregate resolution statistics every N seconds on a separate daemon thread.
 * Never blocks a resolving thread.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final ResolutionStats stats;
    private final String engineId;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private long lastResolutions;
    private long lastBids;
    private long lastSales;
    private long lastLots;
    private long lastRejected;

    public PeriodicStatsLogger(ResolutionStats stats, String engineId, int intervalSeconds) {
        this.stats = stats;
        this.engineId = engineId;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-stats-logger");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::logSummary, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.info("Periodic stats logger started",
                keyValue("event", "STATS_LOGGER_STARTED"),
                keyValue("engine", engineId),
                keyValue("intervalSeconds", intervalSeconds));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Log a final lifetime summary on shutdown.
     */
    public void logShutdownSummary() {
        long totalResolutions = stats.resolutions.get();
        long totalBids = stats.bidsReceived.get();
        long totalSales = stats.sales.get();
        double winRate = totalBids > 0 ? (double) totalSales / totalBids : 0.0;

        logger.info("Shutdown summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("engine", engineId),
                keyValue("totalResolutions", totalResolutions),
                keyValue("totalBids", totalBids),
                keyValue("totalSales", totalSales),
                keyValue("totalLotsAwarded", stats.lotsAwarded.get()),
                keyValue("totalRejected", stats.requestsRejected.get()),
                keyValue("overallWinRate", String.format("%.4f", winRate)));
    }

    void logSummary() {
        try {
            long currentResolutions = stats.resolutions.get();
            long currentBids = stats.bidsReceived.get();
            long currentSales = stats.sales.get();
            long currentLots = stats.lotsAwarded.get();
            long currentRejected = stats.requestsRejected.get();

            long deltaResolutions = currentResolutions - lastResolutions;
            long deltaBids = currentBids - lastBids;
            long deltaSales = currentSales - lastSales;
            long deltaLots = currentLots - lastLots;
            long deltaRejected = currentRejected - lastRejected;
            double winRate = deltaBids > 0 ? (double) deltaSales / deltaBids : 0.0;

            lastResolutions = currentResolutions;
            lastBids = currentBids;
            lastSales = currentSales;
            lastLots = currentLots;
            lastRejected = currentRejected;

            logger.info("Periodic summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("engine", engineId),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("resolutions", deltaResolutions),
                    keyValue("bids", deltaBids),
                    keyValue("sales", deltaSales),
                    keyValue("lotsAwarded", deltaLots),
                    keyValue("rejected", deltaRejected),
                    keyValue("winRate", String.format("%.4f", winRate)));
        } catch (Exception e) {
            logger.error("Error in periodic stats logging", e);
        }
    }

    long getLastResolutions() {
        return lastResolutions;
    }
}
