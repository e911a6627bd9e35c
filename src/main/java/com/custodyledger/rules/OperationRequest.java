package com.custodyledger.rules;

import com.custodyledger.common.Amount;
import com.custodyledger.ledger.OperationType;
import lombok.Value;

/**
 * Deposit or withdrawal under evaluation.
 */
@Value
public class OperationRequest {

    OperationType type;

    /**
     * Account holder the operation is for.
     */
    String principal;

    Amount amount;

    public static OperationRequest deposit(String principal, Amount amount) {
        return new OperationRequest(OperationType.DEPOSIT, principal, amount);
    }

    public static OperationRequest withdrawal(String principal, Amount amount) {
        return new OperationRequest(OperationType.WITHDRAWAL, principal, amount);
    }
}
