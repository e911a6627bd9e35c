package com.custodyledger.executor;

import com.custodyledger.common.Amount;
import com.custodyledger.ledger.OperationType;
import lombok.Value;

import java.time.Instant;

/**
 * Result of a successful deposit or withdrawal.
 */
@Value
public class OperationOutcome {
    OperationType type;
    String principal;
    Amount amount;
    Amount resultingBalance;
    Instant completedAt;
}
