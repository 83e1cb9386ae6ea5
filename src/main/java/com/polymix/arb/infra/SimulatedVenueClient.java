package com.polymix.arb.infra;

import com.polymix.arb.core.VenueClient;
import com.polymix.arb.domain.CancelOrderResult;
import com.polymix.arb.domain.OrderSide;
import com.polymix.arb.domain.OrderStatusResult;
import com.polymix.arb.domain.PlaceOrderResult;
import com.polymix.arb.domain.SettlementStatus;
import com.polymix.arb.domain.Venue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paper-trading stand-in: orders fill in full immediately without touching the venue, while
 * settlement is still read from the real venue so simulated trades resolve against real
 * results.
 */
@Slf4j
public class SimulatedVenueClient implements VenueClient {

    private final VenueClient live;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, BigDecimal> fills = new ConcurrentHashMap<>();

    public SimulatedVenueClient(VenueClient live, Clock clock) {
        this.live = live;
        this.clock = clock;
    }

    @Override
    public Venue venue() {
        return live.venue();
    }

    @Override
    public boolean isReady() {
        return true;
    }

    @Override
    public PlaceOrderResult placeOrder(String marketId, OrderSide side, BigDecimal quantity, BigDecimal price) {
        String orderId = String.format("SIM-%s-%d-%d", venue().name().toLowerCase(Locale.ROOT).substring(0, 4),
                clock.millis(), sequence.incrementAndGet());
        log.info("[SIMULATED] {} BUY {} {} x{} @ {} -> {}", venue().getDisplayName(), side, marketId, quantity,
                price, orderId);
        fills.put(orderId, quantity);
        return PlaceOrderResult.builder()
                .success(true)
                .orderId(orderId)
                .status("filled")
                .filled(quantity)
                .build();
    }

    @Override
    public CancelOrderResult cancelOrder(String orderId) {
        if (fills.remove(orderId) == null) {
            return CancelOrderResult.failed("Unknown simulated order " + orderId);
        }
        log.info("[SIMULATED] {} cancel {}", venue().getDisplayName(), orderId);
        return CancelOrderResult.builder().success(true).cancelledAt(clock.instant()).build();
    }

    @Override
    public OrderStatusResult getOrderStatus(String orderId) {
        BigDecimal filled = fills.get(orderId);
        if (filled == null) {
            return OrderStatusResult.failed("Unknown simulated order " + orderId);
        }
        return OrderStatusResult.builder()
                .success(true)
                .status("filled")
                .filled(filled)
                .remaining(BigDecimal.ZERO)
                .build();
    }

    @Override
    public SettlementStatus getSettlementStatus(String marketId) {
        return live.getSettlementStatus(marketId);
    }
}
