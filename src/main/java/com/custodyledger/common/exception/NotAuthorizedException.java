package com.custodyledger.common.exception;

import java.util.Map;

/**
 * Thrown when a caller reads data that belongs to another principal
 * without holding the privileged read capability.
 */
public class NotAuthorizedException extends LedgerException {

    private final String caller;
    private final String account;

    public NotAuthorizedException(String caller, String account) {
        super(RejectionCode.NOT_AUTHORIZED,
            String.format("Caller %s is not authorized to read account %s", caller, account));
        this.caller = caller;
        this.account = account;
    }

    public String getCaller() {
        return caller;
    }

    public String getAccount() {
        return account;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of(
            "caller", String.valueOf(caller),
            "account", String.valueOf(account));
    }
}
