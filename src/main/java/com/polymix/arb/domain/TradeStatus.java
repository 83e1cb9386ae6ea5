package com.polymix.arb.domain;

public enum TradeStatus {
    PENDING,
    LOCKED,
    SETTLED,
    INCOMPLETE;

    /**
     * Open trades block a second trade on the same outcome pair.
     */
    public boolean isOpen() {
        return this == PENDING || this == LOCKED;
    }
}
