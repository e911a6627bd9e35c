package com.custodyledger.rules;

import com.custodyledger.common.Amount;
import com.custodyledger.common.exception.InsufficientBalanceException;
import com.custodyledger.ledger.LedgerView;
import com.custodyledger.ledger.OperationType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that keeps a withdrawal from taking an account below zero.
 */
@Component
@Order(40)
public class SufficientBalanceRule implements LedgerRule {

    @Override
    public RuleResult evaluate(OperationRequest request, LedgerView ledger) {
        Amount available = ledger.balanceOf(request.getPrincipal());

        if (request.getAmount().isGreaterThan(available)) {
            return RuleResult.decline(new InsufficientBalanceException(available, request.getAmount()));
        }

        return RuleResult.approve();
    }

    @Override
    public boolean appliesTo(OperationType type) {
        return type == OperationType.WITHDRAWAL;
    }

    @Override
    public String getRuleName() {
        return "SufficientBalance";
    }
}
