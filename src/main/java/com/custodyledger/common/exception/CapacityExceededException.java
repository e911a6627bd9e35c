package com.custodyledger.common.exception;

import com.custodyledger.common.Amount;

import java.util.Map;

/**
 * Thrown when admitting a deposit would push the ledger above its capacity limit.
 */
public class CapacityExceededException extends LedgerException {

    private final Amount attempted;
    private final Amount remainingCapacity;

    public CapacityExceededException(Amount attempted, Amount remainingCapacity) {
        super(RejectionCode.CAPACITY_EXCEEDED,
            String.format("Deposit of %s exceeds remaining capacity %s", attempted, remainingCapacity));
        this.attempted = attempted;
        this.remainingCapacity = remainingCapacity;
    }

    public Amount getAttempted() {
        return attempted;
    }

    public Amount getRemainingCapacity() {
        return remainingCapacity;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of(
            "attempted", attempted.toString(),
            "remainingCapacity", remainingCapacity.toString());
    }
}
