package com.auctionengine.metrics;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;

/**
 * All Prometheus metrics for the auction engine, defined in one place.
 */
public class MetricsRegistry {

    public final Histogram resolutionDuration;
    // name: ae_resolution_duration_seconds

    public final Counter resolutionsTotal;
    // name: ae_resolutions_total

    public final Counter bidsReceivedTotal;
    // name: ae_bids_received_total

    public final Counter salesTotal;
    // name: ae_sales_total

    public final Counter lotsAwardedTotal;
    // name: ae_lots_awarded_total

    public final Counter requestsRejectedTotal;
    // name: ae_requests_rejected_total

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    public MetricsRegistry() {
        this(PrometheusRegistry.defaultRegistry, true);
    }

    /**
     * Register on the given registry. Tests pass a private registry so metric
     * names do not clash across instances.
     */
    public MetricsRegistry(PrometheusRegistry registry, boolean includeJvmMetrics) {
        this.registry = registry;

        resolutionDuration = Histogram.builder()
                .name("ae_resolution_duration_seconds")
                .help("Time spent resolving one bid set")
                .labelNames("strategy")
                .classicOnly()
                .classicUpperBounds(0.00001, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5)
                .register(registry);

        resolutionsTotal = Counter.builder()
                .name("ae_resolutions_total")
                .help("Total auctions resolved")
                .labelNames("strategy")
                .register(registry);

        bidsReceivedTotal = Counter.builder()
                .name("ae_bids_received_total")
                .help("Total bids submitted for resolution")
                .labelNames("strategy")
                .register(registry);

        salesTotal = Counter.builder()
                .name("ae_sales_total")
                .help("Total sales produced")
                .labelNames("strategy")
                .register(registry);

        lotsAwardedTotal = Counter.builder()
                .name("ae_lots_awarded_total")
                .help("Total lots awarded across all sales")
                .labelNames("strategy")
                .register(registry);

        requestsRejectedTotal = Counter.builder()
                .name("ae_requests_rejected_total")
                .help("Resolve requests rejected before resolution")
                .labelNames("reason")
                .register(registry);

        if (includeJvmMetrics) {
            JvmMetrics.builder().register(registry);
        }
    }

    /**
     * Start the Prometheus HTTP server on the given port.
     * Exposes /metrics endpoint for Prometheus scraping.
     */
    public void startHttpServer(int port) throws IOException {
        httpServer = HTTPServer.builder()
                .port(port)
                .registry(registry)
                .buildAndStart();
    }

    /**
     * Stop the Prometheus HTTP server.
     */
    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }
}
