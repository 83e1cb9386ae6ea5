package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementScheduler {

    private final SettlementReconciler reconciler;
    private final TradingProperties properties;

    @Scheduled(fixedDelayString = "${arb.settlement.poll-interval-millis:60000}",
            initialDelayString = "${arb.settlement.poll-interval-millis:60000}")
    public void poll() {
        if (!properties.getSettlement().isEnabled()) {
            return;
        }
        try {
            reconciler.reconcile();
        } catch (Exception e) {
            log.error("[SETTLEMENT] Reconciliation pass failed", e);
        }
    }
}
