package com.auctionengine.http;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * HTTP handler for GET /health.
 * Returns a simple health check response with the engine identifier.
 */
public class HealthHttpHandler implements HttpHandler {

    private final String engineId;
    private final Gson gson;

    public HealthHttpHandler(String engineId) {
        this.engineId = engineId;
        this.gson = new Gson();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            send(exchange, 405, "{\"error\":\"Method not allowed\"}");
            return;
        }
        JsonObject response = new JsonObject();
        response.addProperty("status", "UP");
        response.addProperty("engineId", engineId);
        send(exchange, 200, gson.toJson(response));
    }

    private static void send(HttpExchange exchange, int statusCode, String body) throws IOException {
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
