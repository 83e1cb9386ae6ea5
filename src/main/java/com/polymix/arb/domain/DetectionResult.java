package com.polymix.arb.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DetectionResult {
    ArbitrageOpportunity opportunity;
    RejectionReason reason;
    String detail;

    public static DetectionResult found(ArbitrageOpportunity opportunity) {
        return new DetectionResult(opportunity, null, null);
    }

    public static DetectionResult rejected(RejectionReason reason, String detail) {
        return new DetectionResult(null, reason, detail);
    }

    public boolean isFound() {
        return opportunity != null;
    }
}
