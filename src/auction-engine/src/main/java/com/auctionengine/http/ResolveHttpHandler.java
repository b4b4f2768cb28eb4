package com.auctionengine.http;

import com.auctionengine.config.EngineConfig;
import com.auctionengine.domain.Auction;
import com.auctionengine.domain.Sale;
import com.auctionengine.json.AuctionJsonCodec;
import com.auctionengine.json.ResolveRequest;
import com.auctionengine.json.TooManyBidsException;
import com.auctionengine.logging.ResolutionStats;
import com.auctionengine.metrics.MetricsRegistry;
import com.google.gson.JsonParseException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * HTTP handler for POST /auctions/resolve.
 *
 * Decodes the auction and its bids from JSON, resolves them synchronously on
 * the calling HTTP thread and returns the sales. Resolutions share no state,
 * so the handler is safe on a multi-threaded executor.
 */
public class ResolveHttpHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(ResolveHttpHandler.class);

    private final EngineConfig config;
    private final MetricsRegistry metrics;
    private final ResolutionStats stats;
    private final AuctionJsonCodec codec;

    public ResolveHttpHandler(EngineConfig config, MetricsRegistry metrics,
                              ResolutionStats stats) {
        this.config = config;
        this.metrics = metrics;
        this.stats = stats;
        this.codec = new AuctionJsonCodec();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"Method not allowed\"}");
            return;
        }

        try {
            String body;
            try (InputStream is = exchange.getRequestBody()) {
                body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }

            ResolveRequest request;
            try {
                request = codec.decodeRequest(body, config.getMaxBidsPerRequest());
            } catch (TooManyBidsException e) {
                reject(exchange, 413, "too_many_bids", e.getMessage());
                return;
            } catch (JsonParseException | IllegalArgumentException
                     | IllegalStateException | UnsupportedOperationException e) {
                reject(exchange, 400, "invalid_request", e.getMessage());
                return;
            }

            Auction auction = request.auction();
            String strategy = auction.getStrategy().name();

            long start = System.nanoTime();
            List<Sale> sales = auction.resolveBids(request.bids());
            long end = System.nanoTime();

            long lotsAwarded = 0;
            for (Sale sale : sales) {
                lotsAwarded += sale.quantity();
            }
            record(strategy, request.bids().size(), sales.size(), lotsAwarded, end - start);

            sendResponse(exchange, 200, codec.encodeResponse(auction, sales));

        } catch (Exception e) {
            logger.error("Error handling resolve request: {}", e.getMessage(), e);
            sendResponse(exchange, 500, codec.encodeRejection(String.valueOf(e.getMessage())));
        }
    }

    private void record(String strategy, int bids, int sales, long lotsAwarded, long nanos) {
        metrics.resolutionDuration.labelValues(strategy).observe(nanos / 1_000_000_000.0);
        metrics.resolutionsTotal.labelValues(strategy).inc();
        metrics.bidsReceivedTotal.labelValues(strategy).inc(bids);
        metrics.salesTotal.labelValues(strategy).inc(sales);
        metrics.lotsAwardedTotal.labelValues(strategy).inc(lotsAwarded);

        stats.resolutions.incrementAndGet();
        stats.bidsReceived.addAndGet(bids);
        stats.sales.addAndGet(sales);
        stats.lotsAwarded.addAndGet(lotsAwarded);
    }

    private void reject(HttpExchange exchange, int statusCode, String reason, String message)
            throws IOException {
        logger.warn("Rejected resolve request ({}): {}", reason, message);
        metrics.requestsRejectedTotal.labelValues(reason).inc();
        stats.requestsRejected.incrementAndGet();
        sendResponse(exchange, statusCode, codec.encodeRejection(String.valueOf(message)));
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body)
            throws IOException {
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
