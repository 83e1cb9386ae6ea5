package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class LedgerSummary {
    BigDecimal balance;
    BigDecimal initialBalance;
    BigDecimal totalProfit; // realized, settled trades only
    BigDecimal estimatedProfit; // expected, pending trades
    int totalTrades;
    BigDecimal dailyLoss;
    long dailyTrades;
    List<Trade> trades; // newest first
}
