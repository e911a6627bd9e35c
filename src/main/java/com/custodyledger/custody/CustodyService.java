package com.custodyledger.custody;

import com.custodyledger.accounts.AccountSnapshot;
import com.custodyledger.common.Amount;
import com.custodyledger.executor.GuardedOperationExecutor;
import com.custodyledger.executor.OperationGuard;
import com.custodyledger.executor.OperationOutcome;
import com.custodyledger.ledger.GlobalStats;
import com.custodyledger.ledger.LedgerCore;
import com.custodyledger.ledger.LedgerSettings;
import com.custodyledger.ledger.OperationHistory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything the host environment can ask of the ledger.
 *
 * State-mutating calls go through the guarded executor. Queries run under the
 * guard's read access so they see either all or none of an operation.
 */
@Service
@RequiredArgsConstructor
public class CustodyService {

    private final GuardedOperationExecutor executor;
    private final LedgerCore ledgerCore;
    private final OperationGuard guard;

    /**
     * @param caller principal that handed over {@code amountReceived}
     * @param amountReceived value already transferred into custody with this call
     */
    public OperationOutcome deposit(String caller, Amount amountReceived) {
        return executor.deposit(caller, amountReceived);
    }

    /**
     * Value that arrived without naming an operation; treated as a deposit.
     */
    public OperationOutcome receive(String caller, Amount amountReceived) {
        return executor.receive(caller, amountReceived);
    }

    public OperationOutcome withdraw(String caller, Amount amount) {
        return executor.withdraw(caller, amount);
    }

    public Amount balanceOf(String account) {
        return guard.read(() -> ledgerCore.balanceOf(account));
    }

    public AccountSnapshot accountOf(String account) {
        return guard.read(() -> ledgerCore.accountOf(account));
    }

    public Amount remainingCapacity() {
        return guard.read(ledgerCore::remainingCapacity);
    }

    public GlobalStats globalStats() {
        return guard.read(ledgerCore::globalStats);
    }

    public OperationHistory historyOf(String caller, String account) {
        return guard.read(() -> ledgerCore.historyOf(caller, account));
    }

    public boolean isConserved() {
        return guard.read(ledgerCore::checkConservation);
    }

    public LedgerSettings getSettings() {
        return ledgerCore.getSettings();
    }
}
