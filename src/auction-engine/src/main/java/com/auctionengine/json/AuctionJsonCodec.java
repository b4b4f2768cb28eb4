package com.auctionengine.json;

import com.auctionengine.domain.Auction;
import com.auctionengine.domain.AuctionBuilder;
import com.auctionengine.domain.AuctionStrategy;
import com.auctionengine.domain.Bid;
import com.auctionengine.domain.Sale;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JSON mapping for resolve requests and responses.
 *
 * Request:
 * <pre>
 * {"lots":2,"reservePrice":50,"strategy":"SINGLE_PRICE",
 *  "bids":[{"id":"...","amount":55,"quantity":1}]}
 * </pre>
 * lots, reservePrice and strategy are optional and default as in
 * {@link AuctionBuilder}. A bid's id is optional (generated when absent) and
 * its quantity defaults to 1.
 *
 * Decoding problems surface as IllegalArgumentException or Gson's
 * JsonParseException.
 */
public class AuctionJsonCodec {

    private final Gson gson = new GsonBuilder().serializeNulls().create();

    public ResolveRequest decodeRequest(String body) {
        return decodeRequest(body, Integer.MAX_VALUE);
    }

    /**
     * Decode a request, refusing more than {@code maxBids} bids before any of
     * them is converted.
     *
     * @throws TooManyBidsException when the bids array exceeds {@code maxBids}
     */
    public ResolveRequest decodeRequest(String body, int maxBids) {
        JsonElement root = JsonParser.parseString(body);
        if (root == null || !root.isJsonObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        JsonObject json = root.getAsJsonObject();

        AuctionBuilder builder = Auction.builder();
        if (isPresent(json, "lots")) {
            builder.lots(exactLong(json, "lots"));
        }
        if (isPresent(json, "reservePrice")) {
            builder.reservePrice(exactLong(json, "reservePrice"));
        }
        if (isPresent(json, "strategy")) {
            builder.strategy(AuctionStrategy.parse(json.get("strategy").getAsString()));
        }

        if (!isPresent(json, "bids") || !json.get("bids").isJsonArray()) {
            throw new IllegalArgumentException("Missing field: bids");
        }
        JsonArray bidsArray = json.getAsJsonArray("bids");
        if (bidsArray.size() > maxBids) {
            throw new TooManyBidsException(bidsArray.size(), maxBids);
        }
        List<Bid> bids = new ArrayList<>(bidsArray.size());
        for (JsonElement element : bidsArray) {
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("Each bid must be a JSON object");
            }
            bids.add(decodeBid(element.getAsJsonObject()));
        }

        return new ResolveRequest(builder.build(), bids);
    }

    Bid decodeBid(JsonObject bidJson) {
        if (!isPresent(bidJson, "amount")) {
            throw new IllegalArgumentException("Missing field: amount");
        }
        long amount = exactLong(bidJson, "amount");
        long quantity = isPresent(bidJson, "quantity") ? exactLong(bidJson, "quantity") : 1;
        UUID id = isPresent(bidJson, "id")
                ? UUID.fromString(bidJson.get("id").getAsString())
                : UUID.randomUUID();
        return new Bid(id, amount, quantity);
    }

    public String encodeResponse(Auction auction, List<Sale> sales) {
        JsonObject response = new JsonObject();
        response.addProperty("status", "RESOLVED");
        response.addProperty("strategy", auction.getStrategy().name());
        if (sales.isEmpty()) {
            response.add("clearingPrice", null);
        } else {
            // last accepted is the lowest winning amount for both strategies
            response.addProperty("clearingPrice", sales.get(sales.size() - 1).amount());
        }
        long lotsAwarded = 0;
        JsonArray salesArray = new JsonArray();
        for (Sale sale : sales) {
            salesArray.add(encodeSale(sale));
            lotsAwarded += sale.quantity();
        }
        response.addProperty("lotsAwarded", lotsAwarded);
        response.add("sales", salesArray);
        return gson.toJson(response);
    }

    JsonObject encodeSale(Sale sale) {
        JsonObject saleJson = new JsonObject();
        saleJson.addProperty("bidderId", sale.bidderId().toString());
        saleJson.addProperty("amount", sale.amount());
        saleJson.addProperty("quantity", sale.quantity());
        return saleJson;
    }

    public String encodeRejection(String reason) {
        JsonObject response = new JsonObject();
        response.addProperty("status", "REJECTED");
        response.addProperty("reason", reason);
        return gson.toJson(response);
    }

    /**
     * Read an integral field that must fit in a long. Fractions and
     * out-of-range values are rejected instead of being truncated or wrapped.
     */
    static long exactLong(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (!value.isJsonPrimitive()) {
            throw new IllegalArgumentException("Field " + field + " must be a number");
        }
        try {
            return value.getAsBigDecimal().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Field " + field + " must be a whole number within 64-bit range: " + value, e);
        }
    }

    private static boolean isPresent(JsonObject json, String field) {
        return json.has(field) && !json.get(field).isJsonNull();
    }
}
