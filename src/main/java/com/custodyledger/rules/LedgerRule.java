package com.custodyledger.rules;

import com.custodyledger.ledger.LedgerView;
import com.custodyledger.ledger.OperationType;

/**
 * Interface for admissibility rules.
 *
 * Each rule inspects an operation request against the current ledger state
 * and approves it or declines it with a structured rejection. Rules never
 * change state.
 */
public interface LedgerRule {

    /**
     * Evaluate the rule against an operation request.
     *
     * @param request the operation to evaluate
     * @param ledger current ledger state
     * @return the result of the rule evaluation
     */
    RuleResult evaluate(OperationRequest request, LedgerView ledger);

    /**
     * Whether this rule takes part in evaluating operations of the given type.
     */
    boolean appliesTo(OperationType type);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
