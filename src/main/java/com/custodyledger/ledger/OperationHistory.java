package com.custodyledger.ledger;

import com.custodyledger.common.Amount;
import lombok.Value;

import java.util.List;

/**
 * Past amounts of one account, oldest first, deposits and withdrawals kept apart.
 */
@Value
public class OperationHistory {
    String principal;
    List<Amount> deposits;
    List<Amount> withdrawals;

    public static OperationHistory empty(String principal) {
        return new OperationHistory(principal, List.of(), List.of());
    }
}
