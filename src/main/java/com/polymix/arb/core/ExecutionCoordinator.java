package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.ArbitrageOpportunity;
import com.polymix.arb.domain.CancelOrderResult;
import com.polymix.arb.domain.ExecutionOutcome;
import com.polymix.arb.domain.ExecutionResult;
import com.polymix.arb.domain.Leg;
import com.polymix.arb.domain.OrderSide;
import com.polymix.arb.domain.OutcomePair;
import com.polymix.arb.domain.PlaceOrderResult;
import com.polymix.arb.domain.RejectionReason;
import com.polymix.arb.domain.Sizing;
import com.polymix.arb.domain.Trade;
import com.polymix.arb.domain.TradeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Places both legs of an approved opportunity and commits the resulting trade. Either both
 * legs end up in the ledger as one PENDING trade, or nothing does and the first leg has been
 * cancelled.
 */
@Slf4j
@Service
public class ExecutionCoordinator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final VenueClientRegistry venues;
    private final LedgerService ledgerService;
    private final TradingProperties properties;
    private final ExecutorService legExecutor;
    private final Clock clock;

    public enum ExecutionState {
        PRE_FLIGHT_CHECK,
        FIRST_LEG,
        SECOND_LEG,
        COMPENSATING,
        COMMIT,
        COMPLETED
    }

    public ExecutionCoordinator(VenueClientRegistry venues, LedgerService ledgerService,
            TradingProperties properties, @Qualifier("legExecutor") ExecutorService legExecutor, Clock clock) {
        this.venues = venues;
        this.ledgerService = ledgerService;
        this.properties = properties;
        this.legExecutor = legExecutor;
        this.clock = clock;
    }

    public ExecutionResult execute(ArbitrageOpportunity opp, Sizing sizing) {
        String tradeId = opp.pairId();
        ExecutionState state = ExecutionState.PRE_FLIGHT_CHECK;
        log.info("--- START ARB EXECUTION: {} ({}) mode={} ---", tradeId, opp.getPair().description(),
                properties.getMode());

        // STEP 1: Pre-flight, nothing has side effects yet
        if (sizing.getQuantity() == null || sizing.getQuantity().signum() <= 0) {
            return invalid(tradeId, RejectionReason.INVALID_QUANTITY, "Quantity must be positive: " + sizing.getQuantity());
        }
        for (ArbitrageOpportunity.LegQuote leg : opp.legs()) {
            BigDecimal nativePrice = nativePrice(leg);
            if (nativePrice.signum() <= 0 || nativePrice.compareTo(BigDecimal.ONE) >= 0) {
                return invalid(tradeId, RejectionReason.INVALID_PRICE,
                        String.format("%s %s price %s outside (0,1)", leg.getVenue(), leg.getSide(), nativePrice));
            }
            if (!venues.get(leg.getVenue()).isReady()) {
                return invalid(tradeId, RejectionReason.VENUE_NOT_READY, leg.getVenue().getDisplayName() + " client not ready");
            }
        }
        log.info("[EXECUTION] State: {} | qty={} cost=${} - OK", state, sizing.getQuantity(), sizing.getCostUsd());

        ArbitrageOpportunity.LegQuote first = opp.getAway();
        ArbitrageOpportunity.LegQuote second = opp.getHome();

        // STEP 2: First leg
        state = ExecutionState.FIRST_LEG;
        PlaceOrderResult firstResult = placeLeg(state, first, sizing.getQuantity());
        if (!firstResult.isSuccess()) {
            String error = first.getVenue().getDisplayName() + " order failed: " + firstResult.getError();
            log.error("[EXECUTION] State: {} | {}", state, error);
            ledgerService.recordError(tradeId, error);
            return ExecutionResult.rejected(tradeId, ExecutionOutcome.PLACEMENT_FAILED,
                    RejectionReason.FIRST_LEG_FAILED, error);
        }

        // STEP 3: Second leg, compensate the first on failure
        state = ExecutionState.SECOND_LEG;
        PlaceOrderResult secondResult = placeLeg(state, second, sizing.getQuantity());
        if (!secondResult.isSuccess()) {
            String error = second.getVenue().getDisplayName() + " order failed: " + secondResult.getError();
            log.error("[EXECUTION] State: {} | {}", state, error);
            ledgerService.recordError(tradeId, error);

            boolean compensated = compensate(tradeId, first, firstResult.getOrderId());
            return ExecutionResult.builder()
                    .tradeId(tradeId)
                    .outcome(ExecutionOutcome.PLACEMENT_FAILED)
                    .reason(RejectionReason.SECOND_LEG_FAILED)
                    .detail(error)
                    .compensationAttempted(true)
                    .compensated(compensated)
                    .build();
        }

        // STEP 4: Commit
        state = ExecutionState.COMMIT;
        Trade trade = buildTrade(opp, sizing, firstResult, secondResult);
        boolean persisted = ledgerService.commitTrade(trade);

        state = ExecutionState.COMPLETED;
        log.info("--- 🎯 EXECUTION SUCCESSFUL for Arb {} | state={} cost=${} expected profit=${} persisted={} ---",
                tradeId, state, trade.getCost(), trade.getExpectedProfit(), persisted);
        return ExecutionResult.executed(trade, persisted);
    }

    private PlaceOrderResult placeLeg(ExecutionState state, ArbitrageOpportunity.LegQuote leg, BigDecimal quantity) {
        VenueClient client = venues.get(leg.getVenue());
        BigDecimal price = nativePrice(leg);
        log.info("[EXECUTION] State: {} | BUY {} on {} market={} qty={} price={}", state, leg.getSide(),
                leg.getVenue().getDisplayName(), leg.getMarketId(), quantity, price);

        Future<PlaceOrderResult> future = legExecutor.submit(
                () -> client.placeOrder(leg.getMarketId(), OrderSide.YES, quantity, price));
        long timeoutMillis = properties.getLegTimeout().toMillis();
        try {
            PlaceOrderResult result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            return result != null ? result : PlaceOrderResult.failed("No result from venue client");
        } catch (TimeoutException e) {
            future.cancel(true);
            return PlaceOrderResult.failed("Timed out after " + timeoutMillis + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[EXECUTION] {} placement threw", leg.getVenue().getDisplayName(), cause);
            return PlaceOrderResult.failed(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return PlaceOrderResult.failed("Interrupted while placing order");
        }
    }

    private boolean compensate(String tradeId, ArbitrageOpportunity.LegQuote leg, String orderId) {
        String venueName = leg.getVenue().getDisplayName();
        log.error("[EXECUTION] State: {} | 🚨 PARTIAL FILL: cancelling {} order {} for {}",
                ExecutionState.COMPENSATING, venueName, orderId, tradeId);
        CancelOrderResult cancel;
        try {
            cancel = venues.get(leg.getVenue()).cancelOrder(orderId);
        } catch (RuntimeException e) {
            cancel = CancelOrderResult.failed(e.getMessage());
        }
        if (cancel.isSuccess()) {
            log.info("[UNWIND] {} order {} cancelled", venueName, orderId);
            return true;
        }
        String error = String.format("ORPHANED POSITION: %s order %s could not be cancelled (%s)",
                venueName, orderId, cancel.getError());
        log.error("   [UNHEDGED] {}", error);
        ledgerService.recordError(tradeId, error);
        return false;
    }

    private Trade buildTrade(ArbitrageOpportunity opp, Sizing sizing, PlaceOrderResult away, PlaceOrderResult home) {
        OutcomePair pair = opp.getPair();
        BigDecimal quantity = sizing.getQuantity();
        List<Leg> legs = new ArrayList<>(2);
        legs.add(toLeg(pair, opp.getAway(), quantity, away));
        legs.add(toLeg(pair, opp.getHome(), quantity, home));

        BigDecimal fees = legs.stream().map(Leg::getFeeUsd).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal slippage = legs.stream().map(Leg::getSlippageUsd).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal expectedPayout = quantity.setScale(PositionSizer.USD_SCALE, RoundingMode.HALF_UP);

        return Trade.builder()
                .id(opp.pairId())
                .description(pair.description())
                .sport(pair.getSport())
                .gameTime(pair.getGameTime())
                .mode(properties.getMode())
                .legs(legs)
                .quantity(quantity)
                .cost(sizing.getCostUsd())
                .expectedPayout(expectedPayout)
                .expectedProfit(sizing.getProfitUsd())
                .roiPercent(sizing.getRoiPercent())
                .quality(opp.getQuality())
                .totalCostPerUnit(opp.getTotalCost())
                .targetUnits(properties.getTargetUnits())
                .feesTotalUsd(fees)
                .slippageTotalUsd(slippage)
                .status(TradeStatus.PENDING)
                .placedAt(clock.instant())
                .build();
    }

    private Leg toLeg(OutcomePair pair, ArbitrageOpportunity.LegQuote quote, BigDecimal quantity, PlaceOrderResult order) {
        BigDecimal raw = quote.getRawPrice();
        return Leg.builder()
                .venue(quote.getVenue())
                .side(quote.getSide())
                .code(pair.codeFor(quote.getSide()))
                .team(pair.teamFor(quote.getSide()))
                .price(raw)
                .effectivePrice(quote.getEffectivePrice())
                .marketId(quote.getMarketId())
                .url(quote.getUrl())
                .feeRate(quote.getFeeRate())
                .costUsd(PositionSizer.usd(quote.getEffectivePrice().multiply(quantity)))
                .feeUsd(PositionSizer.usd(raw.multiply(quote.getFeeRate()).multiply(quantity)))
                .slippageUsd(PositionSizer.usd(raw.multiply(quote.getSlippage()).multiply(quantity)))
                .payoutUsd(quantity.setScale(PositionSizer.USD_SCALE, RoundingMode.HALF_UP))
                .orderId(order.getOrderId())
                .orderStatus(order.getStatus())
                .build();
    }

    private ExecutionResult invalid(String tradeId, RejectionReason reason, String detail) {
        log.warn("[EXECUTION] State: {} | Rejected {}: {}", ExecutionState.PRE_FLIGHT_CHECK, tradeId, detail);
        return ExecutionResult.rejected(tradeId, ExecutionOutcome.INVALID_ORDER, reason, detail);
    }

    private static BigDecimal nativePrice(ArbitrageOpportunity.LegQuote leg) {
        return leg.getRawPrice().divide(HUNDRED, 6, RoundingMode.HALF_UP);
    }
}
