package com.custodyledger.api.dto;

import com.custodyledger.accounts.AccountSnapshot;
import lombok.Value;

import java.math.BigInteger;

/**
 * Balance and counters of one account.
 */
@Value
public class AccountResponse {
    String principal;
    BigInteger balance;
    long depositCount;
    long withdrawCount;

    public static AccountResponse from(AccountSnapshot snapshot) {
        return new AccountResponse(
            snapshot.getPrincipal(),
            snapshot.getBalance().getUnits(),
            snapshot.getDepositCount(),
            snapshot.getWithdrawCount()
        );
    }
}
