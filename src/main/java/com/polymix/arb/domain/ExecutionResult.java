package com.polymix.arb.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExecutionResult {
    String tradeId;
    ExecutionOutcome outcome;
    RejectionReason reason;
    String detail;
    Trade trade;

    boolean persisted; // false when the ledger write is still outstanding
    boolean compensationAttempted;
    boolean compensated;

    public static ExecutionResult executed(Trade trade, boolean persisted) {
        return ExecutionResult.builder()
                .tradeId(trade.getId())
                .outcome(ExecutionOutcome.EXECUTED)
                .trade(trade)
                .persisted(persisted)
                .build();
    }

    public static ExecutionResult rejected(String tradeId, ExecutionOutcome outcome, RejectionReason reason,
            String detail) {
        return ExecutionResult.builder()
                .tradeId(tradeId)
                .outcome(outcome)
                .reason(reason)
                .detail(detail)
                .build();
    }

    public boolean isExecuted() {
        return outcome == ExecutionOutcome.EXECUTED;
    }
}
