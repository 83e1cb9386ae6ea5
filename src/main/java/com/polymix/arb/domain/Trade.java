package com.polymix.arb.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {
    private String id; // AWAY@HOME
    private String description;
    private String sport;
    private String gameTime;
    private ExecutionMode mode;

    @Builder.Default
    private List<Leg> legs = new ArrayList<>();

    private BigDecimal quantity;
    private BigDecimal cost;
    private BigDecimal expectedPayout;
    private BigDecimal expectedProfit;
    private BigDecimal roiPercent;
    private ArbQuality quality;
    private BigDecimal totalCostPerUnit;
    private BigDecimal targetUnits;
    private BigDecimal feesTotalUsd;
    private BigDecimal slippageTotalUsd;

    private TradeStatus status;
    private Instant placedAt;
    private Instant settledAt;
    private BigDecimal settledAmount;
    private BigDecimal realizedProfit;

    public boolean anyLegMatches(String winner) {
        return legs.stream().anyMatch(l -> l.matchesWinner(winner));
    }
}
