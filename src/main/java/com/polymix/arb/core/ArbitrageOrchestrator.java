package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.DetectionResult;
import com.polymix.arb.domain.ExecutionOutcome;
import com.polymix.arb.domain.ExecutionResult;
import com.polymix.arb.domain.LedgerSummary;
import com.polymix.arb.domain.OutcomePair;
import com.polymix.arb.domain.SizingDecision;
import com.polymix.arb.domain.VenueQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine loop: pulls matched pairs from every feed and runs each through detection, risk
 * and execution, one at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArbitrageOrchestrator {

    private final List<OutcomePairSource> sources;
    private final OpportunityDetector detector;
    private final RiskController riskController;
    private final ExecutionCoordinator coordinator;
    private final LedgerService ledgerService;
    private final ProbabilityNormalizer normalizer;
    private final TradingProperties properties;

    @Scheduled(fixedDelayString = "${arb.engine.loop-interval-millis:5000}")
    public void runLoop() {
        if (!properties.getEngine().isEnabled()) {
            return;
        }
        LedgerSummary summary = ledgerService.summary();
        log.info("Arb Engine Heartbeat [{}]: balance=${} trades={} today={} dailyLoss=${} realized=${} est.=${}",
                properties.getMode(), summary.getBalance(), summary.getTotalTrades(), summary.getDailyTrades(),
                summary.getDailyLoss(), summary.getTotalProfit(), summary.getEstimatedProfit());

        for (OutcomePairSource source : sources) {
            try {
                List<OutcomePair> pairs = source.poll();
                if (!pairs.isEmpty()) {
                    log.debug("Polled {} pair(s) from {}", pairs.size(), source.name());
                    processAll(pairs);
                }
            } catch (Exception e) {
                log.error("Error polling feed: {}", source.name(), e);
            }
        }
    }

    public List<ExecutionResult> processAll(List<OutcomePair> pairs) {
        List<ExecutionResult> results = new ArrayList<>(pairs.size());
        for (OutcomePair pair : pairs) {
            try {
                results.add(process(pair));
            } catch (Exception e) {
                log.error("Failed to process pair {}", pair.id(), e);
                ledgerService.recordError(pair.id(), "Unexpected error: " + e.getMessage());
            }
        }
        return results;
    }

    public ExecutionResult process(OutcomePair pair) {
        logProbabilities(pair);

        DetectionResult detection = detector.detect(pair);
        if (!detection.isFound()) {
            log.debug("No opportunity for {}: {} ({})", pair.id(), detection.getReason(), detection.getDetail());
            return ExecutionResult.rejected(pair.id(), ExecutionOutcome.NO_OPPORTUNITY, detection.getReason(),
                    detection.getDetail());
        }

        // Size, place and commit against one consistent view of the ledger
        return ledgerService.exclusive(() -> {
            SizingDecision decision = riskController.evaluate(detection.getOpportunity(), ledgerService.ledger(),
                    ledgerService.today());
            if (!decision.isApproved()) {
                return ExecutionResult.rejected(pair.id(), ExecutionOutcome.RISK_REJECTED, decision.getReason(),
                        decision.getDetail());
            }
            return coordinator.execute(detection.getOpportunity(), decision.getSizing());
        });
    }

    private void logProbabilities(OutcomePair pair) {
        if (!log.isDebugEnabled()) {
            return;
        }
        for (VenueQuote quote : pair.quotes()) {
            normalizer.normalize(pair, quote).ifPresent(p -> log.debug("{} {}: {}% / {}%", pair.id(),
                    quote.getVenue().getDisplayName(), p.getAway(), p.getHome()));
        }
    }
}
