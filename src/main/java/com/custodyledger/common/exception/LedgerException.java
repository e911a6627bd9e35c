package com.custodyledger.common.exception;

import java.util.Map;

/**
 * Base exception for all ledger rejections and failures.
 *
 * Subclasses carry the structured values that led to the decision so the
 * caller can reconstruct it without parsing the message.
 */
public abstract class LedgerException extends RuntimeException {

    private final RejectionCode code;

    protected LedgerException(RejectionCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(RejectionCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public RejectionCode getCode() {
        return code;
    }

    /**
     * Structured details of the decision, keyed by field name.
     */
    public abstract Map<String, String> getDetails();
}
