package com.custodyledger.rules;

import com.custodyledger.common.Amount;
import com.custodyledger.common.exception.CapacityExceededException;
import com.custodyledger.ledger.LedgerSettings;
import com.custodyledger.ledger.LedgerView;
import com.custodyledger.ledger.OperationType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that keeps deposits within the capacity limit, measured the way the
 * ledger's {@link com.custodyledger.ledger.CapacityPolicy} prescribes.
 */
@Component
@Order(20)
public class CapacityRule implements LedgerRule {

    @Override
    public RuleResult evaluate(OperationRequest request, LedgerView ledger) {
        LedgerSettings settings = ledger.getSettings();
        Amount used = settings.getCapacityPolicy().usedCapacity(ledger);
        Amount afterDeposit = used.add(request.getAmount());

        if (afterDeposit.isGreaterThan(settings.getCapacityLimit())) {
            Amount remaining = settings.getCapacityLimit().subtract(used);
            return RuleResult.decline(new CapacityExceededException(request.getAmount(), remaining));
        }

        return RuleResult.approve();
    }

    @Override
    public boolean appliesTo(OperationType type) {
        return type == OperationType.DEPOSIT;
    }

    @Override
    public String getRuleName() {
        return "Capacity";
    }
}
