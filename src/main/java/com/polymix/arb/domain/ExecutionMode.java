package com.polymix.arb.domain;

public enum ExecutionMode {
    SIMULATED, // fills assumed immediate, no order reaches a venue
    LIVE
}
