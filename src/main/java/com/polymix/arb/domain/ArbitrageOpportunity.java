package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ArbitrageOpportunity {
    OutcomePair pair;
    LegQuote away;
    LegQuote home;

    // Summary metrics, cents per unit
    BigDecimal grossCost;
    BigDecimal totalCost;
    BigDecimal edge;
    ArbQuality quality;
    Instant detectedAt;

    public String pairId() {
        return pair.id();
    }

    public List<LegQuote> legs() {
        return List.of(away, home);
    }

    @Value
    @Builder
    public static class LegQuote {
        OutcomeSide side;
        Venue venue;
        BigDecimal rawPrice;
        BigDecimal effectivePrice;
        BigDecimal feeRate;
        BigDecimal slippage;
        String marketId;
        String url;
    }
}
