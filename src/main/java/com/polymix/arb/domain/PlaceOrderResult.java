package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PlaceOrderResult {
    boolean success;
    String orderId;
    String status;
    BigDecimal filled;
    String error;

    public static PlaceOrderResult failed(String error) {
        return PlaceOrderResult.builder().success(false).error(error).build();
    }
}
