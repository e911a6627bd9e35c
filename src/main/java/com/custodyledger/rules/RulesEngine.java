package com.custodyledger.rules;

import com.custodyledger.ledger.LedgerView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rules engine that evaluates the configured rules against an operation request.
 *
 * Rules are evaluated in order, and the first rule that declines the operation
 * decides the rejection reported to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RulesEngine {

    private final List<LedgerRule> rules;

    /**
     * Engine with the standard rule set in its standard order.
     */
    public static RulesEngine standard() {
        return new RulesEngine(List.of(
            new PositiveAmountRule(),
            new CapacityRule(),
            new WithdrawLimitRule(),
            new SufficientBalanceRule()
        ));
    }

    /**
     * Evaluate all applicable rules against an operation request.
     *
     * @param request the operation to evaluate
     * @param ledger current ledger state
     * @return the result of the rules evaluation
     */
    public RuleResult evaluateRules(OperationRequest request, LedgerView ledger) {
        log.debug("Evaluating {} for {} amount {}", request.getType(), request.getPrincipal(), request.getAmount());

        for (LedgerRule rule : rules) {
            if (!rule.appliesTo(request.getType())) {
                continue;
            }

            RuleResult result = rule.evaluate(request, ledger);

            if (!result.isApproved()) {
                log.info("Rule {} declined {} for {}: {}", rule.getRuleName(), request.getType(),
                    request.getPrincipal(), result.getRejection().getMessage());
                return result;
            }

            log.debug("Rule {} approved", rule.getRuleName());
        }

        return RuleResult.approve();
    }
}
