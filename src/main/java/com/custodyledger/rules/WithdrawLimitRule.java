package com.custodyledger.rules;

import com.custodyledger.common.Amount;
import com.custodyledger.common.exception.WithdrawLimitExceededException;
import com.custodyledger.ledger.LedgerView;
import com.custodyledger.ledger.OperationType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that enforces the per-operation withdrawal limit.
 */
@Component
@Order(30)
public class WithdrawLimitRule implements LedgerRule {

    @Override
    public RuleResult evaluate(OperationRequest request, LedgerView ledger) {
        Amount limit = ledger.getSettings().getWithdrawLimit();

        if (request.getAmount().isGreaterThan(limit)) {
            return RuleResult.decline(new WithdrawLimitExceededException(request.getAmount(), limit));
        }

        return RuleResult.approve();
    }

    @Override
    public boolean appliesTo(OperationType type) {
        return type == OperationType.WITHDRAWAL;
    }

    @Override
    public String getRuleName() {
        return "WithdrawLimit";
    }
}
