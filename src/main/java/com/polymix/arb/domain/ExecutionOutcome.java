package com.polymix.arb.domain;

public enum ExecutionOutcome {
    EXECUTED,
    NO_OPPORTUNITY,
    RISK_REJECTED,
    INVALID_ORDER,
    PLACEMENT_FAILED
}
