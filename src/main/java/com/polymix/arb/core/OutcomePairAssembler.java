package com.polymix.arb.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.polymix.arb.domain.OutcomePair;
import com.polymix.arb.domain.OutcomeSide;
import com.polymix.arb.domain.Venue;
import com.polymix.arb.domain.VenueQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns matched-game records from the market-data feed into validated {@link OutcomePair}s.
 * This is the only place feed fields are looked up; a record that lacks a required field is
 * rejected here and never reaches the engine.
 */
@Slf4j
@Component
public class OutcomePairAssembler {

    // Win/Draw/Win markets
    private static final Set<String> THREE_WAY_SPORTS = Set.of("soccer", "football");

    public List<OutcomePair> assembleAll(JsonNode games) {
        List<OutcomePair> pairs = new ArrayList<>();
        if (games == null || !games.isArray()) {
            return pairs;
        }
        for (JsonNode game : games) {
            try {
                pairs.add(assemble(game));
            } catch (IllegalArgumentException e) {
                log.warn("[FEED] Skipping {}@{}: {}", game.path("away_code").asText("?"),
                        game.path("home_code").asText("?"), e.getMessage());
            }
        }
        return pairs;
    }

    /**
     * @throws IllegalArgumentException if a required field is missing or malformed
     */
    public OutcomePair assemble(JsonNode game) {
        String sport = text(game, "sport");
        boolean threeWay = game.has("three_way")
                ? game.get("three_way").asBoolean()
                : sport != null && THREE_WAY_SPORTS.contains(sport.toLowerCase(Locale.ROOT));
        String gameTime = text(game, "game_time");
        if (gameTime == null) {
            gameTime = text(game, "end_date");
        }
        return OutcomePair.builder()
                .awayCode(text(game, "away_code"))
                .homeCode(text(game, "home_code"))
                .awayTeam(text(game, "away_team"))
                .homeTeam(text(game, "home_team"))
                .sport(sport)
                .gameTime(gameTime)
                .threeWay(threeWay)
                .first(quote(game, Venue.POLYMARKET))
                .second(quote(game, Venue.KALSHI))
                .build();
    }

    private VenueQuote quote(JsonNode game, Venue venue) {
        String key = venue.name().toLowerCase(Locale.ROOT);
        JsonNode node = game.get(key);
        if (node == null || !node.isObject() || node.isEmpty()) {
            throw new IllegalArgumentException("Missing " + venue.getDisplayName() + " data");
        }
        return VenueQuote.builder()
                .venue(venue)
                .awayPrice(price(node, OutcomeSide.AWAY, venue))
                .homePrice(price(node, OutcomeSide.HOME, venue))
                .awayMarketId(marketId(node, OutcomeSide.AWAY))
                .homeMarketId(marketId(node, OutcomeSide.HOME))
                .url(text(node, "url"))
                .build();
    }

    // Un-normalized quotes win over display values
    private static BigDecimal price(JsonNode node, OutcomeSide side, Venue venue) {
        String prefix = side.name().toLowerCase(Locale.ROOT);
        JsonNode value = node.hasNonNull("raw_" + prefix) ? node.get("raw_" + prefix) : node.get(prefix);
        if (value == null || value.isNull() || !value.isNumber()) {
            throw new IllegalArgumentException("Missing " + venue.getDisplayName() + " " + prefix + " price");
        }
        BigDecimal price = value.decimalValue();
        if (price.signum() < 0 || price.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalArgumentException(venue.getDisplayName() + " " + prefix + " price out of range: " + price);
        }
        return price;
    }

    private static String marketId(JsonNode node, OutcomeSide side) {
        String prefix = side.name().toLowerCase(Locale.ROOT);
        for (String field : List.of(prefix + "_market_id", prefix + "_ticker", "market_id")) {
            String id = text(node, field);
            if (id != null) {
                return id;
            }
        }
        return null; // rejected by VenueQuote
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }
}
