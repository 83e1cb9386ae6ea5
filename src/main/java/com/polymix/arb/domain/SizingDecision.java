package com.polymix.arb.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either an approved sizing or a rejection reason, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SizingDecision {
    Sizing sizing;
    RejectionReason reason;
    String detail;

    public static SizingDecision approved(Sizing sizing) {
        return new SizingDecision(sizing, null, null);
    }

    public static SizingDecision rejected(RejectionReason reason, String detail) {
        return new SizingDecision(null, reason, detail);
    }

    public boolean isApproved() {
        return sizing != null;
    }
}
