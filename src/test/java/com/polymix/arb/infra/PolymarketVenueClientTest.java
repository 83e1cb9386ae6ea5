package com.polymix.arb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.CancelOrderResult;
import com.polymix.arb.domain.OrderSide;
import com.polymix.arb.domain.OrderStatusResult;
import com.polymix.arb.domain.PlaceOrderResult;
import com.polymix.arb.domain.SettlementStatus;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PolymarketVenueClientTest {

    private static final String PRIVATE_KEY = "4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String TOKEN_ID = "71321045679252212594626385532706912750332728571942532289631379312455583992563";
    private static final String CREDENTIALS = "{'apiKey':'api-key','secret':'c2VjcmV0LXNlY3JldA==','passphrase':'pass'}";

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper mapper = new ObjectMapper();
    private StubHttp http;
    private TradingProperties properties;

    @BeforeEach
    void setUp() {
        http = new StubHttp();
        properties = StubHttp.properties();
        properties.getPolymarket().setPrivateKey(PRIVATE_KEY);
    }

    private PolymarketVenueClient client() {
        return new PolymarketVenueClient(http.client(), mapper, properties, clock);
    }

    @Test
    void readinessCreatesApiKeyOnce() {
        http.respond(200, CREDENTIALS);
        PolymarketVenueClient client = client();

        assertTrue(client.isReady());
        assertTrue(client.isReady());

        assertEquals(1, http.requests().size());
        Request request = http.request(0);
        assertEquals("POST", request.method());
        assertEquals("/auth/api-key", request.url().encodedPath());
        assertEquals(Credentials.create(PRIVATE_KEY).getAddress(), request.header("POLY_ADDRESS"));
        assertEquals(132, request.header("POLY_SIGNATURE").length());
        assertEquals("1740830400", request.header("POLY_TIMESTAMP"));
        assertEquals("0", request.header("POLY_NONCE"));
    }

    @Test
    void fallsBackToDerivingExistingKey() {
        http.respond(400, "{'error':'key exists'}").respond(200, CREDENTIALS);

        assertTrue(client().isReady());

        assertEquals("GET", http.request(1).method());
        assertEquals("/auth/derive-api-key", http.request(1).url().encodedPath());
    }

    @Test
    void notReadyWhenCredentialsCannotBeObtained() {
        http.respond(401, "{}").respond(401, "{}");

        assertFalse(client().isReady());
    }

    @Test
    void withoutWalletNothingIsSent() {
        properties.getPolymarket().setPrivateKey("");
        PolymarketVenueClient client = client();

        assertFalse(client.isReady());
        assertFalse(client.placeOrder(TOKEN_ID, OrderSide.YES, BigDecimal.TEN, new BigDecimal("0.5")).isSuccess());
        assertTrue(http.requests().isEmpty());
    }

    @Test
    void placesSignedFillOrKillOrder() throws Exception {
        http.respond(200, CREDENTIALS)
                .respond(200, "{'success':true,'orderID':'0xorder','status':'matched','errorMsg':''}");

        PlaceOrderResult result = client().placeOrder(TOKEN_ID, OrderSide.YES, new BigDecimal("100"),
                new BigDecimal("0.28"));

        assertTrue(result.isSuccess());
        assertEquals("0xorder", result.getOrderId());
        assertEquals(0, new BigDecimal("100").compareTo(result.getFilled()));

        Request request = http.request(1);
        assertEquals("/order", request.url().encodedPath());
        assertEquals("api-key", request.header("POLY_API_KEY"));
        assertEquals("pass", request.header("POLY_PASSPHRASE"));
        String body = http.body(1);
        assertEquals(PolymarketClobAuthenticator.hmac("c2VjcmV0LXNlY3JldA==", "1740830400POST/order" + body),
                request.header("POLY_SIGNATURE"));

        JsonNode payload = mapper.readTree(body);
        assertEquals("FOK", payload.get("orderType").asText());
        assertEquals("api-key", payload.get("owner").asText());
        JsonNode order = payload.get("order");
        assertEquals(TOKEN_ID, order.get("tokenId").asText());
        assertEquals("28000000", order.get("makerAmount").asText());
        assertEquals("100000000", order.get("takerAmount").asText());
        assertEquals("BUY", order.get("side").asText());
        assertEquals(132, order.get("signature").asText().length());
    }

    @Test
    void rejectedOrderIsReportedAsFailure() {
        http.respond(200, CREDENTIALS)
                .respond(200, "{'success':false,'orderID':'','errorMsg':'not enough balance / allowance'}");

        PlaceOrderResult result = client().placeOrder(TOKEN_ID, OrderSide.YES, BigDecimal.TEN, new BigDecimal("0.5"));

        assertFalse(result.isSuccess());
        assertEquals("not enough balance / allowance", result.getError());
    }

    @Test
    void noSideIsNotSupported() {
        PlaceOrderResult result = client().placeOrder(TOKEN_ID, OrderSide.NO, BigDecimal.TEN, new BigDecimal("0.5"));

        assertFalse(result.isSuccess());
        assertTrue(http.requests().isEmpty());
    }

    @Test
    void cancelChecksTheCanceledList() {
        http.respond(200, CREDENTIALS)
                .respond(200, "{'canceled':['0xorder'],'not_canceled':{}}")
                .respond(200, "{'canceled':[],'not_canceled':{'0xother':'order already matched'}}");
        PolymarketVenueClient client = client();

        CancelOrderResult cancelled = client.cancelOrder("0xorder");
        CancelOrderResult refused = client.cancelOrder("0xother");

        assertTrue(cancelled.isSuccess());
        assertEquals("DELETE", http.request(1).method());
        assertFalse(refused.isSuccess());
        assertEquals("order already matched", refused.getError());
    }

    @Test
    void orderStatusReportsMatchedSize() {
        http.respond(200, CREDENTIALS)
                .respond(200, "{'status':'LIVE','original_size':'100','size_matched':'35.5'}");

        OrderStatusResult status = client().getOrderStatus("0xorder");

        assertTrue(status.isSuccess());
        assertEquals(0, new BigDecimal("35.5").compareTo(status.getFilled()));
        assertEquals(0, new BigDecimal("64.5").compareTo(status.getRemaining()));
        assertEquals("/data/order/0xorder", http.request(1).url().encodedPath());
    }

    @Test
    void settlementReadsGammaOutcomePrices() {
        http.respond(200, "[{'closed':true,'groupItemTitle':'Lakers',"
                        + "'outcomes':'[\\'Yes\\',\\'No\\']','outcomePrices':'[\\'1\\',\\'0\\']'}]")
                .respond(200, "[{'closed':true,'outcomes':['Yes','No'],'outcomePrices':['0','1']}]")
                .respond(200, "[{'closed':true,'outcomes':['Lakers','Celtics'],'outcomePrices':['0','1']}]")
                .respond(200, "[{'closed':false,'outcomes':['Yes','No'],'outcomePrices':['0.6','0.4']}]")
                .respond(200, "[]");
        properties.getPolymarket().setPrivateKey("");
        PolymarketVenueClient client = client();

        assertEquals(SettlementStatus.resolved("Lakers"), client.getSettlementStatus(TOKEN_ID));
        assertEquals(SettlementStatus.resolved(null), client.getSettlementStatus(TOKEN_ID));
        assertEquals(SettlementStatus.resolved("Celtics"), client.getSettlementStatus(TOKEN_ID));
        assertEquals(SettlementStatus.unresolved(), client.getSettlementStatus(TOKEN_ID));
        assertEquals(SettlementStatus.unresolved(), client.getSettlementStatus(TOKEN_ID));

        assertEquals("gamma-api.polymarket.com", http.request(0).url().host());
        assertEquals(TOKEN_ID, http.request(0).url().queryParameter("clob_token_ids"));
    }
}
