package com.custodyledger.ledger;

import com.custodyledger.accounts.AccountSnapshot;
import com.custodyledger.common.Amount;
import lombok.Value;

/**
 * Ledger state touched by a single operation, captured so the operation can be
 * undone as a whole.
 *
 * {@code account} is {@code null} when the principal had no account yet.
 */
@Value
public class LedgerCheckpoint {
    String principal;
    AccountSnapshot account;
    Amount totalDeposited;
    Amount totalWithdrawn;
    Amount heldBalance;
    long totalDepositOperations;
    long totalWithdrawOperations;
}
