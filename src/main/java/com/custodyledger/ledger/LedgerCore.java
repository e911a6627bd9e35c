package com.custodyledger.ledger;

import com.custodyledger.accounts.Account;
import com.custodyledger.accounts.AccountSnapshot;
import com.custodyledger.common.Amount;
import com.custodyledger.common.exception.NotAuthorizedException;
import com.custodyledger.rules.OperationRequest;
import com.custodyledger.rules.RuleResult;
import com.custodyledger.rules.RulesEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Admissibility and state transitions of the ledger.
 *
 * Each operation is a validate/apply pair. {@code apply*} assumes the matching
 * {@code validate*} approved the same request and that nothing ran in between;
 * the guarded executor provides that. No I/O happens here.
 *
 * Invariants after every applied operation:
 * 1. No balance or total is negative.
 * 2. totalDeposited - totalWithdrawn equals the sum of balances.
 * 3. Used capacity never exceeds the capacity limit.
 * 4. No applied withdrawal exceeds the per-operation limit.
 * 5. Counters grow by exactly one per applied operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerCore {

    private final Ledger ledger;
    private final RulesEngine rulesEngine;

    public LedgerSettings getSettings() {
        return ledger.getSettings();
    }

    public RuleResult validateDeposit(String principal, Amount amount) {
        return rulesEngine.evaluateRules(OperationRequest.deposit(principal, amount), ledger);
    }

    /**
     * Credit a validated deposit.
     *
     * @return the account state after the deposit
     */
    public AccountSnapshot applyDeposit(String principal, Amount amount) {
        LedgerSettings settings = ledger.getSettings();
        Amount used = settings.getCapacityPolicy().usedCapacity(ledger);
        if (amount.isZero() || used.add(amount).isGreaterThan(settings.getCapacityLimit())) {
            throw new IllegalStateException("Deposit of " + amount + " applied without passing validation");
        }

        Account account = ledger.credit(principal, amount);
        log.debug("Applied deposit of {} for {}, balance now {}", amount, principal, account.getBalance());
        return account.snapshot();
    }

    public RuleResult validateWithdraw(String principal, Amount amount) {
        return rulesEngine.evaluateRules(OperationRequest.withdrawal(principal, amount), ledger);
    }

    /**
     * Debit a validated withdrawal. Runs before the outbound transfer so that
     * anything observing the ledger during the transfer already sees the debit.
     *
     * @return the account state after the withdrawal
     */
    public AccountSnapshot applyWithdraw(String principal, Amount amount) {
        if (amount.isZero() || amount.isGreaterThan(ledger.getSettings().getWithdrawLimit())) {
            throw new IllegalStateException("Withdrawal of " + amount + " applied without passing validation");
        }

        Account account = ledger.debit(principal, amount);
        log.debug("Applied withdrawal of {} for {}, balance now {}", amount, principal, account.getBalance());
        return account.snapshot();
    }

    /**
     * Capture what an operation for {@code principal} is about to change.
     */
    public LedgerCheckpoint checkpoint(String principal) {
        return ledger.checkpoint(principal);
    }

    /**
     * Undo everything applied since {@code checkpoint} was taken.
     */
    public void restore(LedgerCheckpoint checkpoint) {
        ledger.restore(checkpoint);
        log.debug("Restored ledger state of {}", checkpoint.getPrincipal());
    }

    public Amount balanceOf(String principal) {
        return ledger.balanceOf(principal);
    }

    public AccountSnapshot accountOf(String principal) {
        return ledger.findAccount(principal)
            .map(Account::snapshot)
            .orElseGet(() -> AccountSnapshot.empty(principal));
    }

    /**
     * Capacity still available under the configured policy.
     *
     * @throws ArithmeticException if used capacity exceeds the limit, which the
     *         invariants rule out
     */
    public Amount remainingCapacity() {
        LedgerSettings settings = ledger.getSettings();
        return settings.getCapacityLimit().subtract(settings.getCapacityPolicy().usedCapacity(ledger));
    }

    public GlobalStats globalStats() {
        return new GlobalStats(
            ledger.getTotalDepositOperations(),
            ledger.getTotalWithdrawOperations(),
            ledger.getHeldBalance(),
            ledger.getTotalDeposited(),
            ledger.getTotalWithdrawn(),
            ledger.getAccountCount()
        );
    }

    /**
     * History of {@code account}, readable by the account holder itself or by
     * the owner.
     *
     * @throws NotAuthorizedException for any other caller
     */
    public OperationHistory historyOf(String caller, String account) {
        if (caller == null || !(caller.equals(account) || ledger.getSettings().isOwner(caller))) {
            throw new NotAuthorizedException(caller, account);
        }
        return ledger.findAccount(account)
            .map(a -> new OperationHistory(account, a.getDepositHistory().stream().toList(),
                a.getWithdrawHistory().stream().toList()))
            .orElseGet(() -> OperationHistory.empty(account));
    }

    /**
     * Whether the running totals agree with the per-account balances.
     */
    public boolean checkConservation() {
        Amount sum = ledger.sumOfBalances();
        Amount held = ledger.getHeldBalance();
        return sum.equals(held)
            && !ledger.getTotalWithdrawn().isGreaterThan(ledger.getTotalDeposited())
            && ledger.getTotalDeposited().subtract(ledger.getTotalWithdrawn()).equals(held);
    }
}
