package com.custodyledger.executor;

import com.custodyledger.accounts.AccountSnapshot;
import com.custodyledger.common.Amount;
import com.custodyledger.common.PrincipalId;
import com.custodyledger.common.exception.TransferFailedException;
import com.custodyledger.events.LedgerNotification;
import com.custodyledger.events.LedgerNotifier;
import com.custodyledger.ledger.LedgerCheckpoint;
import com.custodyledger.ledger.LedgerCore;
import com.custodyledger.ledger.OperationType;
import com.custodyledger.rules.RuleResult;
import com.custodyledger.transfer.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

/**
 * Runs state-mutating ledger operations under the operation guard.
 *
 * Operation flow:
 * 1. Enter the guard (re-entry is rejected, nothing touched)
 * 2. Validate against the rules
 * 3. Apply the state change
 * 4. Withdrawals only: transfer the value out, undoing step 3 if it fails
 * 5. Leave the guard
 * 6. Emit a notification of the completed operation; a failing listener
 *    does not undo or fail the operation
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuardedOperationExecutor {

    private final LedgerCore ledgerCore;
    private final OperationGuard guard;
    private final TransferGateway transferGateway;
    private final LedgerNotifier notifier;
    private final Clock clock;

    private volatile OperationPhase phase = OperationPhase.IDLE;

    /**
     * Credit value the caller has already handed over with this call.
     */
    public OperationOutcome deposit(String principal, Amount amount) {
        return runDeposit(principal, amount, "deposit");
    }

    /**
     * Credit value that arrived without an explicit operation. Admitted under
     * exactly the same rules as {@link #deposit}.
     */
    public OperationOutcome receive(String principal, Amount amount) {
        return runDeposit(principal, amount, "inbound transfer");
    }

    /**
     * Debit the caller's account and transfer the value out.
     *
     * @throws TransferFailedException if the transfer failed; the debit has
     *         been undone by then
     */
    public OperationOutcome withdraw(String principal, Amount amount) {
        PrincipalId.validate(principal);
        Objects.requireNonNull(amount, "amount");

        OperationOutcome outcome;
        try (OperationGuard.Permit permit = guard.acquire()) {
            try {
                moveTo(OperationPhase.VALIDATING);
                RuleResult result = ledgerCore.validateWithdraw(principal, amount);
                if (!result.isApproved()) {
                    moveTo(OperationPhase.REJECTED);
                    throw result.getRejection();
                }

                LedgerCheckpoint checkpoint = ledgerCore.checkpoint(principal);
                moveTo(OperationPhase.MUTATING);
                AccountSnapshot after = ledgerCore.applyWithdraw(principal, amount);

                moveTo(OperationPhase.TRANSFERRING);
                transferOrRestore(permit, principal, amount, checkpoint);

                moveTo(OperationPhase.COMPLETED);
                outcome = new OperationOutcome(OperationType.WITHDRAWAL, principal, amount,
                    after.getBalance(), clock.instant());
            } finally {
                phase = OperationPhase.IDLE;
            }
        }

        log.info("Withdrawal of {} for {} completed via {}, balance {}",
            amount, principal, transferGateway.getGatewayName(), outcome.getResultingBalance());
        publish(outcome);
        return outcome;
    }

    public OperationPhase getPhase() {
        return phase;
    }

    public GuardState getGuardState() {
        return guard.getState();
    }

    private OperationOutcome runDeposit(String principal, Amount amount, String kind) {
        PrincipalId.validate(principal);
        Objects.requireNonNull(amount, "amount");

        OperationOutcome outcome;
        try (OperationGuard.Permit permit = guard.acquire()) {
            try {
                moveTo(OperationPhase.VALIDATING);
                RuleResult result = ledgerCore.validateDeposit(principal, amount);
                if (!result.isApproved()) {
                    moveTo(OperationPhase.REJECTED);
                    throw result.getRejection();
                }

                moveTo(OperationPhase.MUTATING);
                AccountSnapshot after = ledgerCore.applyDeposit(principal, amount);

                moveTo(OperationPhase.COMPLETED);
                outcome = new OperationOutcome(OperationType.DEPOSIT, principal, amount,
                    after.getBalance(), clock.instant());
            } finally {
                phase = OperationPhase.IDLE;
            }
        }

        log.info("Accepted {} of {} for {}, balance {}", kind, amount, principal, outcome.getResultingBalance());
        publish(outcome);
        return outcome;
    }

    private void transferOrRestore(OperationGuard.Permit permit, String principal, Amount amount,
                                   LedgerCheckpoint checkpoint) {
        boolean delivered;
        try {
            delivered = permit.interact(() -> transferGateway.transfer(principal, amount));
        } catch (RuntimeException e) {
            moveTo(OperationPhase.FAULTED);
            ledgerCore.restore(checkpoint);
            log.warn("Transfer of {} to {} threw, withdrawal rolled back", amount, principal, e);
            throw new TransferFailedException(principal, amount, e);
        }

        if (!delivered) {
            moveTo(OperationPhase.FAULTED);
            ledgerCore.restore(checkpoint);
            log.warn("Transfer of {} to {} refused by {}, withdrawal rolled back",
                amount, principal, transferGateway.getGatewayName());
            throw new TransferFailedException(principal, amount);
        }
    }

    /**
     * The operation is committed by the time this runs; a failing listener is
     * logged and never changes the result returned to the caller.
     */
    private void publish(OperationOutcome outcome) {
        try {
            notifier.onOperationCompleted(new LedgerNotification(
                outcome.getType(),
                outcome.getPrincipal(),
                outcome.getAmount(),
                outcome.getResultingBalance(),
                outcome.getCompletedAt()
            ));
        } catch (RuntimeException e) {
            log.error("Notification of completed {} failed: principal={}, amount={}, balance={}, at={}",
                outcome.getType(), outcome.getPrincipal(), outcome.getAmount(),
                outcome.getResultingBalance(), outcome.getCompletedAt(), e);
        }
    }

    private void moveTo(OperationPhase next) {
        log.debug("Operation phase {} -> {}", phase, next);
        phase = next;
    }
}
