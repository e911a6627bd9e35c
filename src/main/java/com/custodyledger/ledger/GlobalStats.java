package com.custodyledger.ledger;

import com.custodyledger.common.Amount;
import lombok.Value;

/**
 * Aggregate counters of a ledger instance.
 */
@Value
public class GlobalStats {
    long totalDepositOperations;
    long totalWithdrawOperations;
    Amount currentHeldBalance;
    Amount totalDeposited;
    Amount totalWithdrawn;
    int accountCount;
}
