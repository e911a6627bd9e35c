package com.custodyledger.ledger;

import com.custodyledger.common.Amount;

/**
 * What the capacity limit bounds.
 *
 * A ledger instance is configured with exactly one policy; the two are never
 * combined.
 */
public enum CapacityPolicy {

    /**
     * The limit bounds the value currently held. Withdrawals free capacity.
     */
    HELD_BALANCE {
        @Override
        public Amount usedCapacity(LedgerView ledger) {
            return ledger.getHeldBalance();
        }
    },

    /**
     * The limit bounds lifetime deposits. Withdrawals never free capacity.
     */
    CUMULATIVE_DEPOSITS {
        @Override
        public Amount usedCapacity(LedgerView ledger) {
            return ledger.getTotalDeposited();
        }
    };

    public abstract Amount usedCapacity(LedgerView ledger);
}
