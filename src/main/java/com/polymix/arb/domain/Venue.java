package com.polymix.arb.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Venue {
    POLYMARKET("Polymarket"),
    KALSHI("Kalshi");

    private final String displayName;
}
