package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.ExecutionOutcome;
import com.polymix.arb.domain.ExecutionResult;
import com.polymix.arb.domain.OutcomePair;
import com.polymix.arb.domain.PlaceOrderResult;
import com.polymix.arb.domain.RejectionReason;
import com.polymix.arb.domain.SettlementStatus;
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
import static com.polymix.arb.core.TestFixtures.pair;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ArbitrageOrchestratorTest {

    private TradingProperties properties;
    private MutableClock clock;
    private LedgerService ledgerService;
    private VenueClient polymarket;
    private VenueClient kalshi;
    private VenueClientRegistry registry;
    private OutcomePairSource source;
    private ExecutorService executor;
    private ArbitrageOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        clock = new MutableClock(TestFixtures.START);
        ledgerService = new LedgerService(new InMemoryLedgerRepository(), properties, clock);

        polymarket = mock(VenueClient.class);
        kalshi = mock(VenueClient.class);
        when(polymarket.venue()).thenReturn(Venue.POLYMARKET);
        when(kalshi.venue()).thenReturn(Venue.KALSHI);
        when(polymarket.isReady()).thenReturn(true);
        when(kalshi.isReady()).thenReturn(true);
        when(polymarket.placeOrder(any(), any(), any(), any())).thenReturn(
                PlaceOrderResult.builder().success(true).orderId("poly-1").status("matched").filled(bd("100")).build());
        when(kalshi.placeOrder(any(), any(), any(), any())).thenReturn(
                PlaceOrderResult.builder().success(true).orderId("kal-1").status("executed").filled(bd("100")).build());
        registry = new VenueClientRegistry(List.of(polymarket, kalshi));

        source = mock(OutcomePairSource.class);
        when(source.name()).thenReturn("test-feed");

        executor = Executors.newCachedThreadPool();
        ExecutionCoordinator coordinator = new ExecutionCoordinator(registry, ledgerService, properties, executor, clock);
        orchestrator = new ArbitrageOrchestrator(
                List.of(source),
                new OpportunityDetector(new FeeSchedule(properties), clock),
                new RiskController(new PositionSizer(properties), properties),
                coordinator,
                ledgerService,
                new ProbabilityNormalizer(),
                properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void detectsExecutesAndSettlesOneArb() {
        ExecutionResult result = orchestrator.process(TestFixtures.perfectPair());

        assertTrue(result.isExecuted());
        assertEquals(0, bd("9902.50").compareTo(ledgerService.ledger().getBalance()));
        assertEquals(TradeStatus.PENDING, result.getTrade().getStatus());

        when(polymarket.getSettlementStatus("polymarket-away")).thenReturn(SettlementStatus.resolved("LAL"));
        when(kalshi.getSettlementStatus("kalshi-home")).thenReturn(SettlementStatus.resolved(null));
        clock.advance(Duration.ofHours(4));
        new SettlementReconciler(registry, ledgerService, properties, executor, clock).reconcile();

        assertEquals(TradeStatus.SETTLED, result.getTrade().getStatus());
        assertEquals(0, bd("10002.50").compareTo(ledgerService.ledger().getBalance()));
        assertEquals(0, bd("2.5").compareTo(ledgerService.summary().getTotalProfit()));
    }

    @Test
    void secondPassOnSamePairIsRejectedAsDuplicate() {
        orchestrator.process(TestFixtures.perfectPair());

        ExecutionResult second = orchestrator.process(TestFixtures.perfectPair());

        assertEquals(ExecutionOutcome.RISK_REJECTED, second.getOutcome());
        assertEquals(RejectionReason.DUPLICATE_TRADE, second.getReason());
        assertEquals(1, ledgerService.ledger().getTrades().size());
        assertEquals(0, bd("9902.50").compareTo(ledgerService.ledger().getBalance()));
        verify(polymarket, times(1)).placeOrder(any(), any(), any(), any());
    }

    @Test
    void pairWithoutEdgeNeverReachesVenues() {
        ExecutionResult result = orchestrator.process(pair("50", "55", "48", "52"));

        assertEquals(ExecutionOutcome.NO_OPPORTUNITY, result.getOutcome());
        assertEquals(RejectionReason.NO_EDGE, result.getReason());
        verify(polymarket, never()).placeOrder(any(), any(), any(), any());
        verify(kalshi, never()).placeOrder(any(), any(), any(), any());
    }

    @Test
    void loopProcessesEveryPolledPair() {
        OutcomePair noEdge = pair("50", "55", "48", "52");
        when(source.poll()).thenReturn(List.of(noEdge, TestFixtures.perfectPair()));

        orchestrator.runLoop();

        assertEquals(1, ledgerService.ledger().getTrades().size());
        assertEquals("LAL@BOS", ledgerService.ledger().getTrades().get(0).getId());
    }

    @Test
    void failingFeedDoesNotStopTheLoop() {
        when(source.poll()).thenThrow(new IllegalStateException("feed unavailable"));

        assertDoesNotThrow(() -> orchestrator.runLoop());
        assertTrue(ledgerService.ledger().getTrades().isEmpty());
    }

    @Test
    void disabledEngineSkipsPolling() {
        properties.getEngine().setEnabled(false);

        orchestrator.runLoop();

        verify(source, never()).poll();
    }
}
