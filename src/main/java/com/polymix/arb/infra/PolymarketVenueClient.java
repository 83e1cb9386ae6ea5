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
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Map;

/**
 * Live Polymarket client. Market ids are CLOB outcome token ids; orders are EIP-712 signed
 * and submitted fill-or-kill, settlement is read from the Gamma market listing.
 */
@Slf4j
public class PolymarketVenueClient extends AbstractVenueClient {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    private static final BigDecimal MICRO_USDC = BigDecimal.valueOf(1_000_000);

    private final PolymarketClobAuthenticator auth; // null when no wallet is configured
    private final PolymarketSigner signer;
    private final String clobUrl;
    private final String gammaUrl;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public PolymarketVenueClient(OkHttpClient httpClient, ObjectMapper objectMapper, TradingProperties properties,
            Clock clock) {
        super(httpClient, objectMapper, properties.getHttp());
        TradingProperties.Polymarket config = properties.getPolymarket();
        this.clobUrl = config.getClobUrl().replaceAll("/+$", "");
        this.gammaUrl = config.getGammaUrl().replaceAll("/+$", "");
        this.clock = clock;
        this.signer = new PolymarketSigner(config.getChainId());
        if (config.getPrivateKey() != null && !config.getPrivateKey().isBlank()) {
            this.auth = new PolymarketClobAuthenticator(config.getPrivateKey(), signer, httpClient, objectMapper,
                    clobUrl, clock);
            log.info("[POLYMARKET] Wallet loaded: {}", auth.address());
        } else {
            this.auth = null;
            log.warn("[POLYMARKET] No private key configured. Live order placement disabled.");
        }
    }

    @Override
    public Venue venue() {
        return Venue.POLYMARKET;
    }

    @Override
    public boolean isReady() {
        if (auth == null) {
            return false;
        }
        try {
            auth.ensureCredentials();
            return true;
        } catch (VenueClientException e) {
            log.warn("[POLYMARKET] Not ready: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public PlaceOrderResult placeOrder(String marketId, OrderSide side, BigDecimal quantity, BigDecimal price) {
        if (auth == null) {
            return PlaceOrderResult.failed("Polymarket wallet not configured");
        }
        if (side != OrderSide.YES) {
            // The complementary outcome is its own token id
            return PlaceOrderResult.failed("Polymarket orders buy the outcome token directly; NO side unsupported");
        }
        try {
            BigDecimal shares = quantity.setScale(2, RoundingMode.DOWN);
            BigDecimal limit = price.setScale(2, RoundingMode.HALF_UP);
            PolymarketSigner.Order order = PolymarketSigner.Order.builder()
                    .salt(BigInteger.valueOf(random.nextInt(Integer.MAX_VALUE)))
                    .maker(auth.address())
                    .signer(auth.address())
                    .taker(ZERO_ADDRESS)
                    .tokenId(new BigInteger(marketId))
                    .makerAmount(shares.multiply(limit).multiply(MICRO_USDC).setScale(0, RoundingMode.DOWN).toBigInteger())
                    .takerAmount(shares.multiply(MICRO_USDC).toBigInteger())
                    .expiration(BigInteger.ZERO)
                    .nonce(BigInteger.ZERO)
                    .feeRateBps(BigInteger.ZERO)
                    .side(0)
                    .signatureType(0)
                    .build();
            String signature = signer.signOrder(order, auth.wallet());

            String body = toJson(orderPayload(order, signature));
            JsonNode response = signed("POST", "/order", body);
            if (!response.path("success").asBoolean(true) || response.path("orderID").asText("").isEmpty()) {
                return PlaceOrderResult.failed(response.path("errorMsg").asText("Order rejected"));
            }
            String status = response.path("status").asText("");
            log.info("[REAL-EXECUTION] Polymarket order {} status={}", response.path("orderID").asText(), status);
            return PlaceOrderResult.builder()
                    .success(true)
                    .orderId(response.path("orderID").asText())
                    .status(status)
                    .filled("matched".equalsIgnoreCase(status) ? shares : BigDecimal.ZERO)
                    .build();
        } catch (VenueClientException | NumberFormatException e) {
            log.error("[REAL-EXECUTION] Polymarket order submission failed", e);
            return PlaceOrderResult.failed(e.getMessage());
        }
    }

    @Override
    public CancelOrderResult cancelOrder(String orderId) {
        if (auth == null) {
            return CancelOrderResult.failed("Polymarket wallet not configured");
        }
        try {
            ObjectNode payload = objectMapper.createObjectNode().put("orderID", orderId);
            JsonNode response = signed("DELETE", "/order", toJson(payload));
            for (JsonNode cancelled : response.path("canceled")) {
                if (orderId.equals(cancelled.asText())) {
                    return CancelOrderResult.builder().success(true).cancelledAt(clock.instant()).build();
                }
            }
            String reason = response.path("not_canceled").path(orderId).asText("not cancelled");
            return CancelOrderResult.failed(reason);
        } catch (VenueClientException e) {
            return CancelOrderResult.failed(e.getMessage());
        }
    }

    @Override
    public OrderStatusResult getOrderStatus(String orderId) {
        if (auth == null) {
            return OrderStatusResult.failed("Polymarket wallet not configured");
        }
        try {
            JsonNode order = signed("GET", "/data/order/" + orderId, null);
            BigDecimal original = decimal(order, "original_size");
            BigDecimal matched = decimal(order, "size_matched");
            return OrderStatusResult.builder()
                    .success(true)
                    .status(order.path("status").asText(""))
                    .filled(matched)
                    .remaining(original.subtract(matched).max(BigDecimal.ZERO))
                    .build();
        } catch (VenueClientException e) {
            return OrderStatusResult.failed(e.getMessage());
        }
    }

    /**
     * A closed market reports one outcome price of 1. Yes/No markets name the team in
     * {@code groupItemTitle}; a NO result means this market's team lost.
     */
    @Override
    public SettlementStatus getSettlementStatus(String marketId) {
        HttpUrl url = HttpUrl.get(gammaUrl + "/markets").newBuilder()
                .addQueryParameter("clob_token_ids", marketId)
                .build();
        JsonNode markets = execute(new Request.Builder().url(url).header("User-Agent", USER_AGENT).get().build());
        JsonNode market = markets.isArray() ? markets.path(0) : markets;
        if (market.isMissingNode() || !market.path("closed").asBoolean(false)) {
            return SettlementStatus.unresolved();
        }

        JsonNode outcomes = embeddedArray(market, "outcomes");
        JsonNode prices = embeddedArray(market, "outcomePrices");
        int winning = -1;
        for (int i = 0; i < prices.size(); i++) {
            if (new BigDecimal(prices.get(i).asText("0")).compareTo(BigDecimal.ONE) == 0) {
                winning = i;
            }
        }
        if (winning < 0 || winning >= outcomes.size()) {
            return SettlementStatus.unresolved();
        }
        String label = outcomes.get(winning).asText();
        if ("yes".equalsIgnoreCase(label)) {
            String team = market.path("groupItemTitle").asText("");
            return SettlementStatus.resolved(team.isBlank() ? null : team);
        }
        if ("no".equalsIgnoreCase(label)) {
            return SettlementStatus.resolved(null);
        }
        return SettlementStatus.resolved(label);
    }

    private JsonNode signed(String method, String path, String body) {
        Request.Builder builder = new Request.Builder()
                .url(clobUrl + path)
                .header("User-Agent", USER_AGENT)
                .method(method, body != null ? jsonBody(body) : null);
        for (Map.Entry<String, String> header : auth.l2Headers(method, path, body).entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return execute(builder.build());
    }

    private ObjectNode orderPayload(PolymarketSigner.Order order, String signature) {
        ObjectNode orderNode = objectMapper.createObjectNode();
        orderNode.put("salt", order.getSalt());
        orderNode.put("maker", order.getMaker());
        orderNode.put("signer", order.getSigner());
        orderNode.put("taker", order.getTaker());
        orderNode.put("tokenId", order.getTokenId().toString());
        orderNode.put("makerAmount", order.getMakerAmount().toString());
        orderNode.put("takerAmount", order.getTakerAmount().toString());
        orderNode.put("expiration", order.getExpiration().toString());
        orderNode.put("nonce", order.getNonce().toString());
        orderNode.put("feeRateBps", order.getFeeRateBps().toString());
        orderNode.put("side", order.getSide() == 0 ? "BUY" : "SELL");
        orderNode.put("signatureType", order.getSignatureType());
        orderNode.put("signature", signature);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("order", orderNode);
        payload.put("owner", auth.ensureCredentials().getKey());
        payload.put("orderType", "FOK");
        return payload;
    }

    // Gamma serializes these arrays as JSON strings
    private JsonNode embeddedArray(JsonNode market, String field) {
        JsonNode node = market.path(field);
        if (node.isArray()) {
            return node;
        }
        try {
            return objectMapper.readTree(node.asText("[]"));
        } catch (IOException e) {
            throw new VenueClientException("Malformed " + field + " for market " + market.path("id").asText(), e);
        }
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        String text = node.path(field).asText("0");
        return text.isBlank() ? BigDecimal.ZERO : new BigDecimal(text);
    }
}
