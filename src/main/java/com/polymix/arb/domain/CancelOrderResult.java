package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CancelOrderResult {
    boolean success;
    Instant cancelledAt;
    String error;

    public static CancelOrderResult failed(String error) {
        return CancelOrderResult.builder().success(false).error(error).build();
    }
}
