package com.custodyledger.common.exception;

/**
 * Stable codes for every way a ledger operation can be refused or fail.
 */
public enum RejectionCode {
    ZERO_AMOUNT,
    CAPACITY_EXCEEDED,
    INSUFFICIENT_BALANCE,
    WITHDRAW_LIMIT_EXCEEDED,
    TRANSFER_FAILED,
    REENTRANCY_REJECTED,
    NOT_AUTHORIZED
}
