package com.custodyledger.api.dto;

import com.custodyledger.executor.OperationOutcome;
import com.custodyledger.ledger.OperationType;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Response to a successful deposit or withdrawal.
 */
@Value
@Builder
public class OperationResponse {
    OperationType type;
    String principal;
    BigInteger amount;
    BigInteger balance;
    Instant completedAt;

    public static OperationResponse from(OperationOutcome outcome) {
        return OperationResponse.builder()
            .type(outcome.getType())
            .principal(outcome.getPrincipal())
            .amount(outcome.getAmount().getUnits())
            .balance(outcome.getResultingBalance().getUnits())
            .completedAt(outcome.getCompletedAt())
            .build();
    }
}
