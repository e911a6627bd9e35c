package com.custodyledger.rules;

import com.custodyledger.common.exception.ZeroAmountException;
import com.custodyledger.ledger.LedgerView;
import com.custodyledger.ledger.OperationType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that refuses deposits and withdrawals of nothing.
 */
@Component
@Order(10)
public class PositiveAmountRule implements LedgerRule {

    @Override
    public RuleResult evaluate(OperationRequest request, LedgerView ledger) {
        if (request.getAmount().isZero()) {
            return RuleResult.decline(new ZeroAmountException());
        }
        return RuleResult.approve();
    }

    @Override
    public boolean appliesTo(OperationType type) {
        return true;
    }

    @Override
    public String getRuleName() {
        return "PositiveAmount";
    }
}
