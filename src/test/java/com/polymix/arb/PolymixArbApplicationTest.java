package com.polymix.arb;

import com.polymix.arb.core.ArbitrageOrchestrator;
import com.polymix.arb.core.LedgerService;
import com.polymix.arb.core.VenueClientRegistry;
import com.polymix.arb.domain.Venue;
import com.polymix.arb.infra.SimulatedVenueClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "arb.ledger-file=target/context-test/ledger.json",
        "arb.engine.enabled=false",
        "arb.settlement.enabled=false",
        "arb.polymarket.private-key=",
        "arb.kalshi.api-key-id="
})
class PolymixArbApplicationTest {

    @Autowired
    private VenueClientRegistry venues;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ArbitrageOrchestrator orchestrator;

    @Test
    void simulatedModeWiresPaperTradingClients() {
        assertInstanceOf(SimulatedVenueClient.class, venues.get(Venue.POLYMARKET));
        assertInstanceOf(SimulatedVenueClient.class, venues.get(Venue.KALSHI));
        assertTrue(venues.get(Venue.KALSHI).isReady());
        assertNotNull(orchestrator);
        assertTrue(ledgerService.ledger().getBalance().compareTo(BigDecimal.ZERO) >= 0);
    }
}
