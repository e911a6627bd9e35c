package com.custodyledger.events;

import com.custodyledger.common.Amount;
import com.custodyledger.ledger.OperationType;
import lombok.Value;

import java.time.Instant;

/**
 * Completed ledger operation, emitted only after it fully succeeded.
 */
@Value
public class LedgerNotification {
    OperationType type;
    String principal;
    Amount amount;
    Amount resultingBalance;
    Instant occurredAt;
}
