package com.polymix.arb.core;

import com.polymix.arb.domain.CancelOrderResult;
import com.polymix.arb.domain.OrderSide;
import com.polymix.arb.domain.OrderStatusResult;
import com.polymix.arb.domain.PlaceOrderResult;
import com.polymix.arb.domain.SettlementStatus;
import com.polymix.arb.domain.Venue;

import java.math.BigDecimal;

/**
 * Order and settlement capability of one trading venue. Authentication is the
 * implementation's concern; callers only check {@link #isReady()}.
 *
 * <p>Order methods report venue-side failures through their result objects.
 * {@link #getSettlementStatus(String)} throws {@link VenueClientException} when the venue
 * cannot be reached.
 */
public interface VenueClient {

    Venue venue();

    /**
     * Credentials are configured and the client can place orders.
     */
    boolean isReady();

    /**
     * @param price native venue scale, strictly between 0 and 1
     */
    PlaceOrderResult placeOrder(String marketId, OrderSide side, BigDecimal quantity, BigDecimal price);

    CancelOrderResult cancelOrder(String orderId);

    OrderStatusResult getOrderStatus(String orderId);

    SettlementStatus getSettlementStatus(String marketId);
}
