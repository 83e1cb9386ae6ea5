package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.Leg;
import com.polymix.arb.domain.ReconciliationReport;
import com.polymix.arb.domain.SettlementStatus;
import com.polymix.arb.domain.Trade;
import com.polymix.arb.domain.TradeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Polls the venues for every PENDING trade and credits payouts once its legs resolve.
 * Venue queries run concurrently outside the ledger lock; the writes go through
 * {@link LedgerService}, which serializes them against placement.
 */
@Slf4j
@Service
public class SettlementReconciler {

    private final VenueClientRegistry venues;
    private final LedgerService ledgerService;
    private final TradingProperties properties;
    private final ExecutorService settlementExecutor;
    private final Clock clock;

    public SettlementReconciler(VenueClientRegistry venues, LedgerService ledgerService,
            TradingProperties properties, @Qualifier("settlementExecutor") ExecutorService settlementExecutor,
            Clock clock) {
        this.venues = venues;
        this.ledgerService = ledgerService;
        this.properties = properties;
        this.settlementExecutor = settlementExecutor;
        this.clock = clock;
    }

    public ReconciliationReport reconcile() {
        List<Trade> pending = ledgerService.exclusive(() -> ledgerService.ledger().pendingTrades());
        if (pending.isEmpty()) {
            return ReconciliationReport.builder().build();
        }
        log.info("[SETTLEMENT] Checking {} pending trade(s)", pending.size());

        List<CompletableFuture<LegCheck>> checks = new ArrayList<>();
        for (Trade trade : pending) {
            for (Leg leg : trade.getLegs()) {
                checks.add(CompletableFuture.supplyAsync(() -> query(trade, leg), settlementExecutor));
            }
        }
        CompletableFuture.allOf(checks.toArray(new CompletableFuture[0])).join();

        int settled = 0;
        int incomplete = 0;
        int stillPending = 0;
        int index = 0;
        for (Trade trade : pending) {
            List<LegCheck> legChecks = new ArrayList<>();
            for (int i = 0; i < trade.getLegs().size(); i++) {
                legChecks.add(checks.get(index++).join());
            }
            TradeStatus outcome = apply(trade, legChecks);
            if (outcome == TradeStatus.SETTLED) {
                settled++;
            } else if (outcome == TradeStatus.INCOMPLETE) {
                incomplete++;
            } else {
                stillPending++;
            }
        }

        ReconciliationReport report = ReconciliationReport.builder()
                .checked(pending.size())
                .settled(settled)
                .incomplete(incomplete)
                .stillPending(stillPending)
                .build();
        log.info("[SETTLEMENT] Pass done: checked={} settled={} incomplete={} pending={}",
                report.getChecked(), settled, incomplete, stillPending);
        return report;
    }

    private TradeStatus apply(Trade trade, List<LegCheck> legChecks) {
        long resolvedCount = legChecks.stream().filter(LegCheck::resolved).count();
        if (resolvedCount == 0) {
            return TradeStatus.PENDING;
        }
        BigDecimal payout = legChecks.stream()
                .filter(LegCheck::won)
                .map(c -> trade.getQuantity())
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(PositionSizer.USD_SCALE, RoundingMode.HALF_UP);

        if (resolvedCount == legChecks.size()) {
            if (ledgerService.applySettlement(trade, TradeStatus.SETTLED, payout)) {
                log.info("[SETTLEMENT] ✅ {} settled: payout=${} realized=${}", trade.getId(), payout,
                        trade.getRealizedProfit());
                return TradeStatus.SETTLED;
            }
            return trade.getStatus();
        }

        Duration age = Duration.between(trade.getPlacedAt(), clock.instant());
        if (age.compareTo(properties.getSettlementTimeout()) >= 0) {
            if (ledgerService.applySettlement(trade, TradeStatus.INCOMPLETE, payout)) {
                String error = String.format("Only %d of %d legs resolved after %dh; closed with payout $%s",
                        resolvedCount, legChecks.size(), age.toHours(), payout);
                log.warn("[SETTLEMENT] ⚠️ {} incomplete: {}", trade.getId(), error);
                ledgerService.recordError(trade.getId(), error);
                return TradeStatus.INCOMPLETE;
            }
            return trade.getStatus();
        }
        return TradeStatus.PENDING;
    }

    private LegCheck query(Trade trade, Leg leg) {
        SettlementStatus status;
        try {
            status = venues.get(leg.getVenue()).getSettlementStatus(leg.getMarketId());
        } catch (RuntimeException e) {
            log.warn("[SETTLEMENT] {} query failed for {} market {}: {}", leg.getVenue().getDisplayName(),
                    trade.getId(), leg.getMarketId(), e.getMessage());
            return LegCheck.UNRESOLVED;
        }
        if (status == null || !status.isResolved()) {
            return LegCheck.UNRESOLVED;
        }
        String winner = status.getWinner();
        if (winner == null) {
            return LegCheck.LOST;
        }
        if (leg.matchesWinner(winner)) {
            return LegCheck.WON;
        }
        if (trade.anyLegMatches(winner)) {
            return LegCheck.LOST;
        }
        // Winner names neither outcome of this trade
        log.warn("[SETTLEMENT] {} market {} reports winner '{}' matching no leg of {}",
                leg.getVenue().getDisplayName(), leg.getMarketId(), winner, trade.getId());
        return LegCheck.UNRESOLVED;
    }

    private enum LegCheck {
        UNRESOLVED,
        WON,
        LOST;

        boolean resolved() {
            return this != UNRESOLVED;
        }

        boolean won() {
            return this == WON;
        }
    }
}
