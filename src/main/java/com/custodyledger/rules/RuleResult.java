package com.custodyledger.rules;

import com.custodyledger.common.exception.LedgerException;
import lombok.Value;

/**
 * Result of a rule evaluation. A declined result carries the rejection that
 * explains it.
 */
@Value
public class RuleResult {
    boolean approved;
    LedgerException rejection;

    public static RuleResult approve() {
        return new RuleResult(true, null);
    }

    public static RuleResult decline(LedgerException rejection) {
        return new RuleResult(false, rejection);
    }

    /**
     * @throws LedgerException the rejection, if declined
     */
    public void orThrow() {
        if (!approved) {
            throw rejection;
        }
    }
}
