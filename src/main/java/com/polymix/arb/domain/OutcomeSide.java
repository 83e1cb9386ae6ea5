package com.polymix.arb.domain;

public enum OutcomeSide {
    AWAY, HOME
}
