package com.custodyledger.common.exception;

import com.custodyledger.common.Amount;

import java.util.Map;

/**
 * Thrown when a single withdrawal asks for more than the per-operation limit.
 */
public class WithdrawLimitExceededException extends LedgerException {

    private final Amount requested;
    private final Amount limit;

    public WithdrawLimitExceededException(Amount requested, Amount limit) {
        super(RejectionCode.WITHDRAW_LIMIT_EXCEEDED,
            String.format("Withdrawal amount %s exceeds limit %s", requested, limit));
        this.requested = requested;
        this.limit = limit;
    }

    public Amount getRequested() {
        return requested;
    }

    public Amount getLimit() {
        return limit;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of(
            "requested", requested.toString(),
            "limit", limit.toString());
    }
}
