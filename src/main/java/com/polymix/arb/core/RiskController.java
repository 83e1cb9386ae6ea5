package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.ArbitrageOpportunity;
import com.polymix.arb.domain.Ledger;
import com.polymix.arb.domain.RejectionReason;
import com.polymix.arb.domain.Sizing;
import com.polymix.arb.domain.SizingDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Sizes an opportunity and checks it against the configured limits and the current ledger.
 * Limits are always checked against the exact post-sizing cost.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskController {

    private final PositionSizer sizer;
    private final TradingProperties properties;

    public SizingDecision evaluate(ArbitrageOpportunity opportunity, Ledger ledger, LocalDate today) {
        if (ledger.rollDailyCounters(today)) {
            log.info("[RISK] New UTC day {} - daily counters reset", today);
        }

        Sizing sizing = sizer.size(opportunity);
        BigDecimal cost = sizing.getCostUsd();

        if (sizing.getQuantity().signum() <= 0) {
            return reject(opportunity, RejectionReason.INVALID_QUANTITY,
                    "Sized below one whole unit (target " + properties.getTargetUnits() + ")");
        }
        if (sizing.getRoiPercent().compareTo(properties.getMinRoiPercent()) <= 0) {
            return reject(opportunity, RejectionReason.ROI_BELOW_MINIMUM,
                    String.format("ROI (%.2f%%) below threshold (%s%%)", sizing.getRoiPercent(),
                            properties.getMinRoiPercent()));
        }
        if (cost.compareTo(ledger.getBalance()) > 0) {
            return reject(opportunity, RejectionReason.INSUFFICIENT_BALANCE,
                    String.format("Insufficient balance: $%.2f < $%.2f", ledger.getBalance(), cost));
        }
        if (cost.compareTo(properties.getMaxPositionSize()) > 0) {
            return reject(opportunity, RejectionReason.POSITION_LIMIT,
                    String.format("Position size ($%.2f) exceeds limit ($%.2f)", cost, properties.getMaxPositionSize()));
        }
        if (ledger.tradesOn(today) >= properties.getMaxDailyTrades()) {
            return reject(opportunity, RejectionReason.DAILY_TRADE_LIMIT,
                    "Daily trade limit reached (" + properties.getMaxDailyTrades() + ")");
        }
        BigDecimal dailyLoss = ledger.getDailyRisk().getDailyLoss();
        if (dailyLoss.compareTo(properties.getDailyLossLimit()) >= 0) {
            return reject(opportunity, RejectionReason.DAILY_LOSS_LIMIT,
                    String.format("Daily loss limit reached ($%.2f), current: $%.2f",
                            properties.getDailyLossLimit(), dailyLoss));
        }
        if (ledger.findOpenTrade(opportunity.pairId()).isPresent()) {
            return reject(opportunity, RejectionReason.DUPLICATE_TRADE, "Market already traded");
        }

        log.info("[RISK] Approved {} | qty={} cost=${} profit=${} roi={}%", opportunity.pairId(),
                sizing.getQuantity(), cost, sizing.getProfitUsd(), sizing.getRoiPercent());
        return SizingDecision.approved(sizing);
    }

    private SizingDecision reject(ArbitrageOpportunity opportunity, RejectionReason reason, String detail) {
        log.info("[RISK] Rejected {} ({}): {}", opportunity.pairId(), reason, detail);
        return SizingDecision.rejected(reason, detail);
    }
}
