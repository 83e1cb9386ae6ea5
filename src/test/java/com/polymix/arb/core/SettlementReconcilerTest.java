package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.Leg;
import com.polymix.arb.domain.OutcomeSide;
import com.polymix.arb.domain.ReconciliationReport;
import com.polymix.arb.domain.SettlementStatus;
import com.polymix.arb.domain.Trade;
import com.polymix.arb.domain.TradeStatus;
import com.polymix.arb.domain.Venue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.polymix.arb.core.TestFixtures.bd;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SettlementReconcilerTest {

    private TradingProperties properties;
    private MutableClock clock;
    private LedgerService ledgerService;
    private VenueClient polymarket;
    private VenueClient kalshi;
    private ExecutorService settlementExecutor;
    private SettlementReconciler reconciler;
    private Trade trade;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        clock = new MutableClock(TestFixtures.START);
        ledgerService = new LedgerService(new InMemoryLedgerRepository(), properties, clock);

        polymarket = mock(VenueClient.class);
        kalshi = mock(VenueClient.class);
        when(polymarket.venue()).thenReturn(Venue.POLYMARKET);
        when(kalshi.venue()).thenReturn(Venue.KALSHI);

        settlementExecutor = Executors.newFixedThreadPool(2);
        reconciler = new SettlementReconciler(new VenueClientRegistry(List.of(polymarket, kalshi)), ledgerService,
                properties, settlementExecutor, clock);

        trade = Trade.builder()
                .id("LAL@BOS")
                .legs(List.of(
                        leg(Venue.POLYMARKET, OutcomeSide.AWAY, "LAL", "Los Angeles Lakers", "polymarket-away"),
                        leg(Venue.KALSHI, OutcomeSide.HOME, "BOS", "Boston Celtics", "kalshi-home")))
                .quantity(bd("100"))
                .cost(bd("97.5000"))
                .expectedPayout(bd("100.0000"))
                .expectedProfit(bd("2.5000"))
                .status(TradeStatus.PENDING)
                .placedAt(clock.instant())
                .build();
        ledgerService.commitTrade(trade);
    }

    @AfterEach
    void tearDown() {
        settlementExecutor.shutdownNow();
    }

    private static Leg leg(Venue venue, OutcomeSide side, String code, String team, String marketId) {
        return Leg.builder().venue(venue).side(side).code(code).team(team).marketId(marketId).build();
    }

    @Test
    void creditsPayoutOnceBothLegsResolve() {
        when(polymarket.getSettlementStatus("polymarket-away"))
                .thenReturn(SettlementStatus.resolved("Los Angeles Lakers"));
        when(kalshi.getSettlementStatus("kalshi-home")).thenReturn(SettlementStatus.resolved(null));
        clock.advance(Duration.ofHours(3));

        ReconciliationReport report = reconciler.reconcile();

        assertEquals(1, report.getChecked());
        assertEquals(1, report.getSettled());
        assertEquals(TradeStatus.SETTLED, trade.getStatus());
        assertEquals(bd("100.0000"), trade.getSettledAmount());
        assertEquals(0, bd("2.5").compareTo(trade.getRealizedProfit()));
        assertEquals(0, bd("10002.50").compareTo(ledgerService.ledger().getBalance()));
        assertEquals(clock.instant(), trade.getSettledAt());
    }

    @Test
    void settledTradeIsNotCheckedAgain() {
        when(polymarket.getSettlementStatus("polymarket-away")).thenReturn(SettlementStatus.resolved("LAL"));
        when(kalshi.getSettlementStatus("kalshi-home")).thenReturn(SettlementStatus.resolved("LAL"));

        reconciler.reconcile();
        ReconciliationReport second = reconciler.reconcile();

        assertEquals(0, second.getChecked());
        verify(polymarket, times(1)).getSettlementStatus("polymarket-away");
        assertEquals(0, bd("10002.50").compareTo(ledgerService.ledger().getBalance()));
    }

    @Test
    void partiallyResolvedTradeWaitsThenClosesIncomplete() {
        when(polymarket.getSettlementStatus("polymarket-away")).thenReturn(SettlementStatus.resolved("BOS"));
        when(kalshi.getSettlementStatus("kalshi-home")).thenReturn(SettlementStatus.unresolved());
        clock.advance(Duration.ofHours(23));

        ReconciliationReport early = reconciler.reconcile();

        assertEquals(1, early.getStillPending());
        assertEquals(TradeStatus.PENDING, trade.getStatus());

        clock.advance(Duration.ofHours(1));
        ReconciliationReport late = reconciler.reconcile();

        assertEquals(1, late.getIncomplete());
        assertEquals(TradeStatus.INCOMPLETE, trade.getStatus());
        assertEquals(0, bd("-97.5").compareTo(trade.getRealizedProfit()));
        assertEquals(0, bd("97.5").compareTo(ledgerService.ledger().getDailyRisk().getDailyLoss()));
        assertEquals(0, bd("9902.50").compareTo(ledgerService.ledger().getBalance()));
        assertTrue(ledgerService.ledger().getErrors().get(0).getError().contains("Only 1 of 2 legs"));
    }

    @Test
    void winnerMatchingNoLegLeavesTradePending() {
        when(polymarket.getSettlementStatus("polymarket-away")).thenReturn(SettlementStatus.resolved("MIA"));
        when(kalshi.getSettlementStatus("kalshi-home")).thenReturn(SettlementStatus.resolved("Miami Heat"));
        clock.advance(Duration.ofHours(48));

        ReconciliationReport report = reconciler.reconcile();

        assertEquals(1, report.getStillPending());
        assertEquals(TradeStatus.PENDING, trade.getStatus());
        assertEquals(0, bd("9902.50").compareTo(ledgerService.ledger().getBalance()));
    }

    @Test
    void failedQueryCountsAsUnresolved() {
        when(polymarket.getSettlementStatus("polymarket-away")).thenThrow(new VenueClientException("HTTP 503"));
        when(kalshi.getSettlementStatus("kalshi-home")).thenReturn(SettlementStatus.resolved(null));

        ReconciliationReport report = reconciler.reconcile();

        assertEquals(1, report.getStillPending());
        assertEquals(TradeStatus.PENDING, trade.getStatus());
    }

    @Test
    void nothingToDoWithoutPendingTrades() {
        trade.setStatus(TradeStatus.SETTLED);

        ReconciliationReport report = reconciler.reconcile();

        assertEquals(0, report.getChecked());
        verify(kalshi, never()).getSettlementStatus(any());
    }
}
