package com.custodyledger.common.exception;

import java.util.Map;

/**
 * Thrown when an operation is invoked while another operation on the same
 * ledger is still in progress and cannot be waited for: on the calling thread,
 * during that operation's outbound transfer, or past the guard's acquire timeout.
 */
public class ReentrancyRejectedException extends LedgerException {

    public ReentrancyRejectedException() {
        this("Ledger operation already in progress");
    }

    public ReentrancyRejectedException(String message) {
        super(RejectionCode.REENTRANCY_REJECTED, message);
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
