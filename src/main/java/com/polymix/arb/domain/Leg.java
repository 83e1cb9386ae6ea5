package com.polymix.arb.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Leg {
    private Venue venue;
    private OutcomeSide side;
    private String code; // outcome code, e.g. LAL
    private String team; // display name
    private BigDecimal price; // raw quote, cents
    private BigDecimal effectivePrice;
    private String marketId;
    private String url;

    private BigDecimal feeRate;
    private BigDecimal costUsd;
    private BigDecimal feeUsd;
    private BigDecimal slippageUsd;
    private BigDecimal payoutUsd; // if this leg wins

    private String orderId;
    private String orderStatus;

    /**
     * A venue reports the winner either by outcome code or by display name.
     */
    public boolean matchesWinner(String winner) {
        if (winner == null || winner.isBlank()) {
            return false;
        }
        String w = winner.trim();
        return w.equals(code) || (team != null && w.equalsIgnoreCase(team));
    }
}
