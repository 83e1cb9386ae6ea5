package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One venue's raw two-outcome quote, prices on the 0-100 scale.
 */
@Value
public class VenueQuote {
    Venue venue;
    BigDecimal awayPrice;
    BigDecimal homePrice;
    String awayMarketId;
    String homeMarketId;
    String url;

    @Builder
    public VenueQuote(Venue venue, BigDecimal awayPrice, BigDecimal homePrice,
            String awayMarketId, String homeMarketId, String url) {
        this.venue = Objects.requireNonNull(venue, "venue");
        this.awayPrice = Objects.requireNonNull(awayPrice, "awayPrice");
        this.homePrice = Objects.requireNonNull(homePrice, "homePrice");
        this.awayMarketId = requireText(awayMarketId, "awayMarketId");
        this.homeMarketId = requireText(homeMarketId, "homeMarketId");
        this.url = url == null ? "" : url;
    }

    public BigDecimal priceFor(OutcomeSide side) {
        return side == OutcomeSide.AWAY ? awayPrice : homePrice;
    }

    public String marketIdFor(OutcomeSide side) {
        return side == OutcomeSide.AWAY ? awayMarketId : homeMarketId;
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }
}
