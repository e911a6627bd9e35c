package com.custodyledger.common.exception;

import com.custodyledger.common.Amount;

import java.util.Map;

/**
 * Thrown when the outbound transfer of a withdrawal fails.
 *
 * By the time this is thrown the debit applied before the transfer has been
 * restored, so the ledger holds the same state as before the withdrawal.
 */
public class TransferFailedException extends LedgerException {

    private final String to;
    private final Amount amount;

    public TransferFailedException(String to, Amount amount) {
        super(RejectionCode.TRANSFER_FAILED,
            String.format("Transfer of %s to %s failed", amount, to));
        this.to = to;
        this.amount = amount;
    }

    public TransferFailedException(String to, Amount amount, Throwable cause) {
        super(RejectionCode.TRANSFER_FAILED,
            String.format("Transfer of %s to %s failed: %s", amount, to, cause.getMessage()), cause);
        this.to = to;
        this.amount = amount;
    }

    public String getTo() {
        return to;
    }

    public Amount getAmount() {
        return amount;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of(
            "to", to,
            "amount", amount.toString());
    }
}
