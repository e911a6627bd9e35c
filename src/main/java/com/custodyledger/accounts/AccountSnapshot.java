package com.custodyledger.accounts;

import com.custodyledger.common.Amount;
import lombok.Value;

/**
 * Point-in-time, read-only copy of an account's balance and counters.
 */
@Value
public class AccountSnapshot {
    String principal;
    Amount balance;
    long depositCount;
    long withdrawCount;
    int depositEntries;
    int withdrawEntries;

    public static AccountSnapshot empty(String principal) {
        return new AccountSnapshot(principal, Amount.ZERO, 0, 0, 0, 0);
    }
}
