package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one binary matchup quoted on two venues. Built once per feed poll;
 * the constructor is the only place required fields are checked.
 */
@Value
public class OutcomePair {
    String awayCode;
    String homeCode;
    String awayTeam;
    String homeTeam;
    String sport;
    String gameTime;
    boolean threeWay; // market also has a draw outcome
    VenueQuote first;
    VenueQuote second;

    @Builder
    public OutcomePair(String awayCode, String homeCode, String awayTeam, String homeTeam, String sport,
            String gameTime, boolean threeWay, VenueQuote first, VenueQuote second) {
        this.awayCode = VenueQuote.requireText(awayCode, "awayCode");
        this.homeCode = VenueQuote.requireText(homeCode, "homeCode");
        this.awayTeam = awayTeam == null || awayTeam.isBlank() ? this.awayCode : awayTeam.trim();
        this.homeTeam = homeTeam == null || homeTeam.isBlank() ? this.homeCode : homeTeam.trim();
        this.sport = sport == null ? "unknown" : sport;
        this.gameTime = gameTime == null ? "" : gameTime;
        this.threeWay = threeWay;
        this.first = Objects.requireNonNull(first, "first quote");
        this.second = Objects.requireNonNull(second, "second quote");
        if (first.getVenue() == second.getVenue()) {
            throw new IllegalArgumentException("Both quotes come from " + first.getVenue());
        }
    }

    /**
     * Deterministic key used for duplicate-trade detection, e.g. {@code LAL@BOS}.
     */
    public String id() {
        return awayCode + "@" + homeCode;
    }

    public String description() {
        return awayTeam + " vs " + homeTeam;
    }

    public String codeFor(OutcomeSide side) {
        return side == OutcomeSide.AWAY ? awayCode : homeCode;
    }

    public String teamFor(OutcomeSide side) {
        return side == OutcomeSide.AWAY ? awayTeam : homeTeam;
    }

    public List<VenueQuote> quotes() {
        return List.of(first, second);
    }
}
