package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class OrderStatusResult {
    boolean success;
    String status;
    BigDecimal filled;
    BigDecimal remaining;
    String error;

    public static OrderStatusResult failed(String error) {
        return OrderStatusResult.builder().success(false).error(error).build();
    }
}
