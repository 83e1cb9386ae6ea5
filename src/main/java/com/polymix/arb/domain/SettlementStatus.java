package com.polymix.arb.domain;

import lombok.Value;

/**
 * Resolution of one venue market. A resolved market with a null winner means the
 * outcome this market tracks did not win.
 */
@Value
public class SettlementStatus {
    boolean resolved;
    String winner;

    public static SettlementStatus unresolved() {
        return new SettlementStatus(false, null);
    }

    public static SettlementStatus resolved(String winner) {
        return new SettlementStatus(true, winner);
    }
}
