package com.custodyledger.api.dto;

import com.custodyledger.common.Amount;
import com.custodyledger.ledger.OperationHistory;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Past deposit and withdrawal amounts of one account, oldest first.
 */
@Value
public class HistoryResponse {
    String principal;
    List<BigInteger> deposits;
    List<BigInteger> withdrawals;

    public static HistoryResponse from(OperationHistory history) {
        return new HistoryResponse(
            history.getPrincipal(),
            history.getDeposits().stream().map(Amount::getUnits).toList(),
            history.getWithdrawals().stream().map(Amount::getUnits).toList()
        );
    }
}
