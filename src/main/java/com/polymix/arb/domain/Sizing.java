package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Sizing {
    BigDecimal quantity; // units, each pays $1 if its leg wins
    BigDecimal costUsd;
    BigDecimal profitUsd;
    BigDecimal roiPercent;
}
