package com.auctionengine.config;

import java.util.Map;

/**
 * Configuration parsed from environment variables.
 * Auction parameters are per request; this only covers the service around them.
 */
public class EngineConfig {

    private final String engineId;
    private final int httpPort;
    private final int metricsPort;
    private final int statsIntervalSeconds;
    private final int maxBidsPerRequest;

    public EngineConfig(String engineId, int httpPort, int metricsPort,
                        int statsIntervalSeconds, int maxBidsPerRequest) {
        this.engineId = engineId;
        this.httpPort = httpPort;
        this.metricsPort = metricsPort;
        this.statsIntervalSeconds = statsIntervalSeconds;
        this.maxBidsPerRequest = maxBidsPerRequest;
    }

    /**
     * Parse configuration from environment variables with sensible defaults.
     */
    public static EngineConfig fromEnv() {
        return fromMap(System.getenv());
    }

    static EngineConfig fromMap(Map<String, String> env) {
        String engineId = get(env, "ENGINE_ID", "auction-1");
        int httpPort = getInt(env, "HTTP_PORT", 8080);
        int metricsPort = getInt(env, "METRICS_PORT", 9091);
        int statsIntervalSeconds = getInt(env, "STATS_INTERVAL_SECONDS", 10);
        int maxBidsPerRequest = getInt(env, "MAX_BIDS_PER_REQUEST", 100_000);

        return new EngineConfig(engineId, httpPort, metricsPort,
                statsIntervalSeconds, maxBidsPerRequest);
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public String getEngineId() {
        return engineId;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    public int getMaxBidsPerRequest() {
        return maxBidsPerRequest;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "engineId='" + engineId + '\'' +
                ", httpPort=" + httpPort +
                ", metricsPort=" + metricsPort +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                ", maxBidsPerRequest=" + maxBidsPerRequest +
                '}';
    }
}
