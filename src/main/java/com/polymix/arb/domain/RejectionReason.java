package com.polymix.arb.domain;

public enum RejectionReason {
    // detection
    ZERO_PRICE,
    SAME_VENUE,
    NO_EDGE,

    // risk
    ROI_BELOW_MINIMUM,
    INSUFFICIENT_BALANCE,
    POSITION_LIMIT,
    DAILY_TRADE_LIMIT,
    DAILY_LOSS_LIMIT,
    DUPLICATE_TRADE,

    // order validation
    INVALID_QUANTITY,
    INVALID_PRICE,
    VENUE_NOT_READY,

    // placement
    FIRST_LEG_FAILED,
    SECOND_LEG_FAILED
}
