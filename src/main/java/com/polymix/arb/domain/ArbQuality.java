package com.polymix.arb.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

@Getter
@RequiredArgsConstructor
public enum ArbQuality {
    PERFECT(BigDecimal.ONE), // total effective cost < 100
    NEAR(new BigDecimal("0.5")), // 100 <= cost <= 105
    PARTIAL(new BigDecimal("0.3")); // venues diverge by more than 3 points on one outcome

    private final BigDecimal sizeMultiplier;
}
