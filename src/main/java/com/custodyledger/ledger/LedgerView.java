package com.custodyledger.ledger;

import com.custodyledger.common.Amount;

/**
 * Read-only view of ledger state used by admissibility rules.
 */
public interface LedgerView {

    LedgerSettings getSettings();

    /**
     * Balance of the principal, zero if it never deposited.
     */
    Amount balanceOf(String principal);

    /**
     * Sum of all account balances.
     */
    Amount getHeldBalance();

    Amount getTotalDeposited();

    Amount getTotalWithdrawn();
}
