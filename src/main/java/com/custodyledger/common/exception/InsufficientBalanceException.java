package com.custodyledger.common.exception;

import com.custodyledger.common.Amount;

import java.util.Map;

/**
 * Thrown when an account has insufficient balance for a withdrawal.
 */
public class InsufficientBalanceException extends LedgerException {

    private final Amount available;
    private final Amount requested;

    public InsufficientBalanceException(Amount available, Amount requested) {
        super(RejectionCode.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance. Requested: %s, Available: %s", requested, available));
        this.available = available;
        this.requested = requested;
    }

    public Amount getAvailable() {
        return available;
    }

    public Amount getRequested() {
        return requested;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of(
            "available", available.toString(),
            "requested", requested.toString());
    }
}
