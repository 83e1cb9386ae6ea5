package com.polymix.arb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.core.VenueClientException;
import com.polymix.arb.domain.CancelOrderResult;
import com.polymix.arb.domain.OrderSide;
import com.polymix.arb.domain.OrderStatusResult;
import com.polymix.arb.domain.PlaceOrderResult;
import com.polymix.arb.domain.SettlementStatus;
import com.polymix.arb.domain.Venue;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

/**
 * Live Kalshi client. Market ids are market tickers; quantities are whole contracts and
 * prices whole cents.
 */
@Slf4j
public class KalshiVenueClient extends AbstractVenueClient {

    private final KalshiRequestSigner signer; // null when no RSA key is configured
    private final String baseUrl;
    private final Clock clock;

    public KalshiVenueClient(OkHttpClient httpClient, ObjectMapper objectMapper, TradingProperties properties,
            Clock clock) {
        this(httpClient, objectMapper, properties, clock, createSigner(properties.getKalshi(), clock));
    }

    KalshiVenueClient(OkHttpClient httpClient, ObjectMapper objectMapper, TradingProperties properties, Clock clock,
            KalshiRequestSigner signer) {
        super(httpClient, objectMapper, properties.getHttp());
        this.baseUrl = properties.getKalshi().getBaseUrl().replaceAll("/+$", "");
        this.clock = clock;
        this.signer = signer;
    }

    private static KalshiRequestSigner createSigner(TradingProperties.Kalshi config, Clock clock) {
        if (config.getApiKeyId() == null || config.getApiKeyId().isBlank()) {
            log.warn("[KALSHI] No API key id configured. Live order placement disabled.");
            return null;
        }
        try {
            return new KalshiRequestSigner(config.getApiKeyId(),
                    KalshiRequestSigner.loadPrivateKey(config.getPrivateKey(), config.getPrivateKeyPath()), clock);
        } catch (IllegalArgumentException e) {
            log.error("[KALSHI] Failed to initialize RSA authentication", e);
            return null;
        }
    }

    @Override
    public Venue venue() {
        return Venue.KALSHI;
    }

    @Override
    public boolean isReady() {
        return signer != null;
    }

    @Override
    public PlaceOrderResult placeOrder(String marketId, OrderSide side, BigDecimal quantity, BigDecimal price) {
        if (signer == null) {
            return PlaceOrderResult.failed("Kalshi credentials not configured");
        }
        if (quantity.signum() <= 0 || quantity.stripTrailingZeros().scale() > 0) {
            return PlaceOrderResult.failed("Kalshi orders need a whole number of contracts, got " + quantity);
        }
        int count = quantity.intValueExact();
        int cents = price.movePointRight(2).setScale(0, RoundingMode.HALF_UP).intValueExact();
        String sideName = side.name().toLowerCase(Locale.ROOT);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("ticker", marketId);
        payload.put("action", "buy");
        payload.put("side", sideName);
        payload.put("count", count);
        payload.put("type", "limit");
        payload.put(sideName + "_price", cents);
        payload.put("client_order_id", UUID.randomUUID().toString());
        try {
            JsonNode order = request("POST", "/portfolio/orders", toJson(payload)).path("order");
            String orderId = order.path("order_id").asText("");
            if (orderId.isEmpty()) {
                return PlaceOrderResult.failed("Kalshi returned no order id");
            }
            log.info("[REAL-EXECUTION] Kalshi order {} status={}", orderId, order.path("status").asText());
            return PlaceOrderResult.builder()
                    .success(true)
                    .orderId(orderId)
                    .status(order.path("status").asText(""))
                    .filled(filledCount(order))
                    .build();
        } catch (VenueClientException e) {
            log.error("[REAL-EXECUTION] Kalshi order submission failed: {}", e.getMessage());
            return PlaceOrderResult.failed(e.getMessage());
        }
    }

    @Override
    public CancelOrderResult cancelOrder(String orderId) {
        if (signer == null) {
            return CancelOrderResult.failed("Kalshi credentials not configured");
        }
        try {
            request("DELETE", "/portfolio/orders/" + orderId, null);
            return CancelOrderResult.builder().success(true).cancelledAt(clock.instant()).build();
        } catch (VenueClientException e) {
            return CancelOrderResult.failed(e.getMessage());
        }
    }

    @Override
    public OrderStatusResult getOrderStatus(String orderId) {
        if (signer == null) {
            return OrderStatusResult.failed("Kalshi credentials not configured");
        }
        try {
            JsonNode order = request("GET", "/portfolio/orders/" + orderId, null).path("order");
            BigDecimal filled = filledCount(order);
            BigDecimal remaining = order.has("remaining_count")
                    ? order.get("remaining_count").decimalValue()
                    : order.path("count").decimalValue().subtract(filled);
            return OrderStatusResult.builder()
                    .success(true)
                    .status(order.path("status").asText(""))
                    .filled(filled)
                    .remaining(remaining.max(BigDecimal.ZERO))
                    .build();
        } catch (VenueClientException e) {
            return OrderStatusResult.failed(e.getMessage());
        }
    }

    /**
     * A market resolves YES for the outcome named in {@code yes_sub_title}; a NO result means
     * this market's outcome lost.
     */
    @Override
    public SettlementStatus getSettlementStatus(String marketId) {
        JsonNode market = request("GET", "/markets/" + marketId, null).path("market");
        String result = market.path("result").asText("").toLowerCase(Locale.ROOT);
        if ("no".equals(result)) {
            return SettlementStatus.resolved(null);
        }
        if (!"yes".equals(result)) {
            return SettlementStatus.unresolved();
        }
        String winner = market.path("yes_sub_title").asText("");
        if (winner.isBlank()) {
            // Game tickers end in the outcome code, e.g. ...-LAL
            int dash = marketId.lastIndexOf('-');
            winner = dash >= 0 ? marketId.substring(dash + 1) : marketId;
        }
        return SettlementStatus.resolved(winner);
    }

    private JsonNode request(String method, String path, String body) {
        Request.Builder builder = new Request.Builder()
                .url(baseUrl + path)
                .header("User-Agent", USER_AGENT)
                .method(method, body != null ? jsonBody(body) : null);
        if (signer != null) {
            signer.headers(method, path).forEach(builder::header);
        }
        return execute(builder.build());
    }

    // Older payloads use filled_count
    private static BigDecimal filledCount(JsonNode order) {
        JsonNode filled = order.has("fill_count") ? order.get("fill_count") : order.path("filled_count");
        return filled.isNumber() ? filled.decimalValue() : BigDecimal.ZERO;
    }
}
