package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.OutcomePair;
import com.polymix.arb.domain.Venue;
import com.polymix.arb.domain.VenueQuote;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

final class TestFixtures {

    static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    private TestFixtures() {
    }

    static TradingProperties properties() {
        TradingProperties properties = new TradingProperties();
        properties.setPersistBackoff(Duration.ZERO);
        properties.setLegTimeout(Duration.ofSeconds(2));
        return properties;
    }

    /**
     * Polymarket quote first, Kalshi second; market ids are {@code <venue>-<side>}.
     */
    static OutcomePair pair(String polyAway, String polyHome, String kalshiAway, String kalshiHome) {
        return OutcomePair.builder()
                .awayCode("LAL")
                .homeCode("BOS")
                .awayTeam("Los Angeles Lakers")
                .homeTeam("Boston Celtics")
                .sport("nba")
                .gameTime("2025-03-01T19:30:00Z")
                .first(quote(Venue.POLYMARKET, polyAway, polyHome))
                .second(quote(Venue.KALSHI, kalshiAway, kalshiHome))
                .build();
    }

    static VenueQuote quote(Venue venue, String away, String home) {
        String prefix = venue.name().toLowerCase();
        return VenueQuote.builder()
                .venue(venue)
                .awayPrice(new BigDecimal(away))
                .homePrice(new BigDecimal(home))
                .awayMarketId(prefix + "-away")
                .homeMarketId(prefix + "-home")
                .url("https://" + prefix + ".example/LAL-BOS")
                .build();
    }

    /**
     * Polymarket away 28 (28.7 effective) and Kalshi home 64 (68.8 effective): a perfect
     * arb costing exactly 97.5 per unit.
     */
    static OutcomePair perfectPair() {
        return pair("28", "70", "30", "64");
    }

    static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }
}
