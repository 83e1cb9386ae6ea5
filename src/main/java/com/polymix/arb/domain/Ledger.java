package com.polymix.arb.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Account state owned by exactly one engine instance. Persisted as a whole document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ledger {
    private BigDecimal balance;
    private BigDecimal initialBalance;

    @Builder.Default
    private List<Trade> trades = new ArrayList<>(); // insertion order

    @Builder.Default
    private DailyRisk dailyRisk = new DailyRisk();

    @Builder.Default
    private List<ErrorEntry> errors = new ArrayList<>();

    public static Ledger fresh(BigDecimal initialBalance, LocalDate today) {
        return Ledger.builder()
                .balance(initialBalance)
                .initialBalance(initialBalance)
                .dailyRisk(DailyRisk.builder().resetDate(today).build())
                .build();
    }

    public Optional<Trade> findOpenTrade(String tradeId) {
        return trades.stream()
                .filter(t -> t.getId().equals(tradeId) && t.getStatus() != null && t.getStatus().isOpen())
                .findFirst();
    }

    public List<Trade> pendingTrades() {
        return trades.stream().filter(t -> t.getStatus() == TradeStatus.PENDING).toList();
    }

    /**
     * Clears the daily counters the first time a new UTC date is observed.
     *
     * @return true if the counters were reset
     */
    public boolean rollDailyCounters(LocalDate today) {
        if (today.equals(dailyRisk.getResetDate())) {
            return false;
        }
        dailyRisk.setDailyLoss(BigDecimal.ZERO);
        dailyRisk.getTrades().clear();
        dailyRisk.setResetDate(today);
        return true;
    }

    public long tradesOn(LocalDate day) {
        return dailyRisk.getTrades().stream().filter(e -> day.equals(e.getDate())).count();
    }

    public void recordError(String tradeId, String error, Instant at, int capacity) {
        errors.add(new ErrorEntry(tradeId, error, at));
        if (errors.size() > capacity) {
            errors.subList(0, errors.size() - capacity).clear();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyRisk {
        @Builder.Default
        private BigDecimal dailyLoss = BigDecimal.ZERO;
        @Builder.Default
        private List<DailyTradeEntry> trades = new ArrayList<>();
        private LocalDate resetDate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyTradeEntry {
        private LocalDate date;
        private String tradeId;
        private Instant timestamp;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorEntry {
        private String tradeId;
        private String error;
        private Instant timestamp;
    }
}
