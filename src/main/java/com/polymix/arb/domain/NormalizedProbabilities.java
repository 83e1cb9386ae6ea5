package com.polymix.arb.domain;

import lombok.Value;

@Value
public class NormalizedProbabilities {
    int away;
    int home;
}
