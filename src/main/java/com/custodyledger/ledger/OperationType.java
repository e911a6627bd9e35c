package com.custodyledger.ledger;

/**
 * Kinds of state-mutating ledger operations.
 */
public enum OperationType {
    /**
     * Value received into custody, explicitly or as an unsolicited inbound transfer.
     */
    DEPOSIT,

    /**
     * Value released from custody to the account holder.
     */
    WITHDRAWAL
}
