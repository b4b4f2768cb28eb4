package com.auctionengine;

import com.auctionengine.config.EngineConfig;
import com.auctionengine.http.HealthHttpHandler;
import com.auctionengine.http.ResolveHttpHandler;
import com.auctionengine.logging.PeriodicStatsLogger;
import com.auctionengine.logging.ResolutionStats;
import com.auctionengine.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main entry point for the Auction Engine service.
 *
 * Startup sequence:
 * 1. Parse EngineConfig from environment variables
 * 2. Initialize MetricsRegistry + Prometheus HTTP server
 * 3. Start the periodic stats logger
 * 4. Start HttpServer with /auctions/resolve and /health handlers
 * 5. Register JVM shutdown hook
 */
public class AuctionEngineApp {

    private static final Logger logger = LoggerFactory.getLogger(AuctionEngineApp.class);

    public static void main(String[] args) {
        logger.info("Starting Auction Engine...");

        // 1. Parse configuration from environment variables
        EngineConfig config = EngineConfig.fromEnv();
        logger.info("Configuration: {}", config);

        // 2. Initialize MetricsRegistry and start Prometheus HTTP server
        MetricsRegistry metrics = new MetricsRegistry();
        try {
            metrics.startHttpServer(config.getMetricsPort());
            logger.info("Prometheus metrics HTTP server started on port {}",
                    config.getMetricsPort());
        } catch (IOException e) {
            logger.error("Failed to start Prometheus HTTP server on port {}: {}",
                    config.getMetricsPort(), e.getMessage());
            System.exit(1);
        }

        // 3. Periodic stats logger (separate daemon thread)
        ResolutionStats stats = new ResolutionStats();
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(
                stats, config.getEngineId(), config.getStatsIntervalSeconds());
        statsLogger.start();

        // 4. Start HTTP server
        HttpServer httpServer = null;
        try {
            httpServer = createHttpServer(config.getHttpPort(), config, metrics, stats);
            httpServer.start();
            logger.info("HTTP server started on port {}", config.getHttpPort());
        } catch (IOException e) {
            logger.error("Failed to start HTTP server on port {}: {}",
                    config.getHttpPort(), e.getMessage());
            System.exit(1);
        }

        // 5. Register shutdown hook
        final HttpServer httpServerRef = httpServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down Auction Engine...");
            stopHttpServer(httpServerRef, 1);

            statsLogger.logShutdownSummary();
            statsLogger.stop();

            metrics.close();
            logger.info("Auction Engine shut down complete.");
        }));

        logger.info("Auction Engine is ready. Engine: {}, HTTP: {}, Metrics: {}",
                config.getEngineId(), config.getHttpPort(), config.getMetricsPort());
    }

    /**
     * Create (but do not start) the HTTP server with all handlers registered.
     */
    public static HttpServer createHttpServer(int port, EngineConfig config,
                                              MetricsRegistry metrics,
                                              ResolutionStats stats) throws IOException {
        HttpServer httpServer = HttpServer.create(new InetSocketAddress(port), 0);
        httpServer.createContext("/auctions/resolve",
                new ResolveHttpHandler(config, metrics, stats));
        httpServer.createContext("/health",
                new HealthHttpHandler(config.getEngineId()));
        httpServer.setExecutor(Executors.newFixedThreadPool(
                Runtime.getRuntime().availableProcessors()));
        return httpServer;
    }

    /**
     * Stop the HTTP server and shut down the request executor created by
     * {@link #createHttpServer}.
     */
    public static void stopHttpServer(HttpServer httpServer, int delaySeconds) {
        httpServer.stop(delaySeconds);
        Executor executor = httpServer.getExecutor();
        if (executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdown();
        }
    }
}
