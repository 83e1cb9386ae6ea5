package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationReport {
    int checked;
    int settled;
    int incomplete;
    int stillPending;
}
