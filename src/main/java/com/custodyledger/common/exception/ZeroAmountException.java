package com.custodyledger.common.exception;

import java.util.Map;

/**
 * Thrown when a deposit or withdrawal is requested for a zero amount.
 */
public class ZeroAmountException extends LedgerException {

    public ZeroAmountException() {
        super(RejectionCode.ZERO_AMOUNT, "Amount must be greater than zero");
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
