package com.custodyledger.executor;

import com.custodyledger.common.Amount;
import com.custodyledger.common.exception.CapacityExceededException;
import com.custodyledger.common.exception.InsufficientBalanceException;
import com.custodyledger.common.exception.LedgerException;
import com.custodyledger.common.exception.ReentrancyRejectedException;
import com.custodyledger.common.exception.TransferFailedException;
import com.custodyledger.common.exception.WithdrawLimitExceededException;
import com.custodyledger.common.exception.ZeroAmountException;
import com.custodyledger.events.LedgerNotification;
import com.custodyledger.events.LedgerNotifier;
import com.custodyledger.ledger.GlobalStats;
import com.custodyledger.ledger.Ledger;
import com.custodyledger.ledger.LedgerCore;
import com.custodyledger.ledger.LedgerSettings;
import com.custodyledger.ledger.OperationType;
import com.custodyledger.rules.RulesEngine;
import com.custodyledger.transfer.InMemoryTransferGateway;
import com.custodyledger.transfer.TransferGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the guarded operation flow: ordering of validation, state
 * change and transfer, rejection of re-entry, and rollback on transfer failure.
 */
@ExtendWith(MockitoExtension.class)
class GuardedOperationExecutorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private LedgerNotifier notifier;

    private LedgerCore ledgerCore;
    private OperationGuard guard;
    private InMemoryTransferGateway gateway;
    private GuardedOperationExecutor executor;

    @BeforeEach
    void setUp() {
        LedgerSettings settings = LedgerSettings.builder()
            .capacityLimit(Amount.of(1000))
            .withdrawLimit(Amount.of(100))
            .build();
        ledgerCore = new LedgerCore(new Ledger(settings), RulesEngine.standard());
        guard = new OperationGuard();
        gateway = new InMemoryTransferGateway();
        executor = newExecutor(gateway);
    }

    private GuardedOperationExecutor newExecutor(TransferGateway transferGateway) {
        return new GuardedOperationExecutor(ledgerCore, guard, transferGateway, notifier,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testDepositNotifiesWithResultingBalance() {
        OperationOutcome outcome = executor.deposit("alice", Amount.of(600));

        assertEquals(OperationType.DEPOSIT, outcome.getType());
        assertEquals(Amount.of(600), outcome.getResultingBalance());
        assertEquals(NOW, outcome.getCompletedAt());

        ArgumentCaptor<LedgerNotification> captor = ArgumentCaptor.forClass(LedgerNotification.class);
        verify(notifier).onOperationCompleted(captor.capture());
        assertEquals("alice", captor.getValue().getPrincipal());
        assertEquals(Amount.of(600), captor.getValue().getAmount());
        assertEquals(Amount.of(600), captor.getValue().getResultingBalance());
        assertEquals(GuardState.IDLE, executor.getGuardState());
        assertEquals(OperationPhase.IDLE, executor.getPhase());
    }

    @Test
    void testReceiveSharesDepositRules() {
        executor.receive("alice", Amount.of(700));

        assertThrows(CapacityExceededException.class, () -> executor.receive("bob", Amount.of(301)));
        assertThrows(ZeroAmountException.class, () -> executor.receive("bob", Amount.ZERO));

        GlobalStats stats = ledgerCore.globalStats();
        assertEquals(1, stats.getTotalDepositOperations());
        assertEquals(Amount.of(700), stats.getCurrentHeldBalance());
        verify(notifier, times(1)).onOperationCompleted(any());
    }

    @Test
    void testRejectionLeavesStateAndGuardUntouched() {
        executor.deposit("alice", Amount.of(600));
        reset(notifier);

        assertThrows(WithdrawLimitExceededException.class, () -> executor.withdraw("alice", Amount.of(150)));
        assertThrows(InsufficientBalanceException.class, () -> executor.withdraw("bob", Amount.of(1)));

        assertEquals(Amount.of(600), ledgerCore.balanceOf("alice"));
        assertEquals(0, ledgerCore.globalStats().getTotalWithdrawOperations());
        assertTrue(gateway.getPayouts().isEmpty());
        assertEquals(GuardState.IDLE, executor.getGuardState());
        verifyNoInteractions(notifier);
    }

    @Test
    void testWithdrawDebitsBeforeTransfer() {
        executor.deposit("alice", Amount.of(600));
        List<Amount> balanceSeenDuringTransfer = new ArrayList<>();
        List<OperationPhase> phaseDuringTransfer = new ArrayList<>();
        gateway.setDuringTransfer((to, amount) -> {
            balanceSeenDuringTransfer.add(guard.read(() -> ledgerCore.balanceOf(to)));
            phaseDuringTransfer.add(executor.getPhase());
        });

        OperationOutcome outcome = executor.withdraw("alice", Amount.of(100));

        assertEquals(List.of(Amount.of(500)), balanceSeenDuringTransfer);
        assertEquals(List.of(OperationPhase.TRANSFERRING), phaseDuringTransfer);
        assertEquals(Amount.of(500), outcome.getResultingBalance());
        assertEquals(Amount.of(100), gateway.deliveredTo("alice"));
        assertEquals(Amount.of(100), ledgerCore.globalStats().getTotalWithdrawn());
    }

    @Test
    void testReentrantWithdrawRejectedDuringTransfer() {
        executor.deposit("alice", Amount.of(300));
        List<LedgerException> innerFailures = new ArrayList<>();
        gateway.setDuringTransfer((to, amount) -> {
            try {
                executor.withdraw(to, amount);
            } catch (LedgerException e) {
                innerFailures.add(e);
            }
            try {
                executor.deposit(to, amount);
            } catch (LedgerException e) {
                innerFailures.add(e);
            }
        });

        executor.withdraw("alice", Amount.of(100));

        assertEquals(2, innerFailures.size());
        assertTrue(innerFailures.stream().allMatch(e -> e instanceof ReentrancyRejectedException));
        assertEquals(Amount.of(200), ledgerCore.balanceOf("alice"));
        assertEquals(1, ledgerCore.globalStats().getTotalWithdrawOperations());
        assertEquals(1, ledgerCore.globalStats().getTotalDepositOperations());
        assertEquals(1, gateway.getPayouts().size());
        assertTrue(ledgerCore.checkConservation());
    }

    @Test
    void testReentryEscapingTransferRollsBackOuterWithdrawal() {
        executor.deposit("alice", Amount.of(300));
        gateway.setDuringTransfer((to, amount) -> executor.withdraw(to, amount));

        TransferFailedException e = assertThrows(TransferFailedException.class,
            () -> executor.withdraw("alice", Amount.of(100)));

        assertInstanceOf(ReentrancyRejectedException.class, e.getCause());
        assertEquals(Amount.of(300), ledgerCore.balanceOf("alice"));
        assertEquals(0, ledgerCore.globalStats().getTotalWithdrawOperations());
        assertEquals(GuardState.IDLE, executor.getGuardState());
    }

    @Test
    void testRefusedTransferRestoresDebit() {
        executor.deposit("alice", Amount.of(600));
        reset(notifier);
        gateway.setHealthy(false);

        TransferFailedException e = assertThrows(TransferFailedException.class,
            () -> executor.withdraw("alice", Amount.of(100)));

        assertEquals("alice", e.getTo());
        assertEquals(Amount.of(100), e.getAmount());
        assertEquals(Amount.of(600), ledgerCore.balanceOf("alice"));
        assertEquals(Amount.ZERO, ledgerCore.globalStats().getTotalWithdrawn());
        assertEquals(0, ledgerCore.accountOf("alice").getWithdrawCount());
        assertTrue(ledgerCore.checkConservation());
        assertEquals(GuardState.IDLE, executor.getGuardState());
        verifyNoInteractions(notifier);
    }

    @Test
    void testThrowingTransferRestoresDebit() {
        TransferGateway failing = mock(TransferGateway.class);
        when(failing.transfer(anyString(), any())).thenThrow(new IllegalStateException("network down"));
        executor = newExecutor(failing);
        executor.deposit("alice", Amount.of(600));

        TransferFailedException e = assertThrows(TransferFailedException.class,
            () -> executor.withdraw("alice", Amount.of(100)));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(Amount.of(600), ledgerCore.balanceOf("alice"));
        assertTrue(ledgerCore.checkConservation());

        // guard is free again
        doReturn(true).when(failing).transfer(anyString(), any());
        assertEquals(Amount.of(500), executor.withdraw("alice", Amount.of(100)).getResultingBalance());
    }

    @Test
    void testInvalidPrincipalRejectedBeforeGuard() {
        assertThrows(IllegalArgumentException.class, () -> executor.deposit("", Amount.of(1)));
        assertThrows(NullPointerException.class, () -> executor.withdraw("alice", null));
        assertEquals(GuardState.IDLE, executor.getGuardState());
    }

    @Test
    void testReentryFromWorkerThreadRejectedDuringTransfer() {
        executor.deposit("alice", Amount.of(300));
        ExecutorService worker = Executors.newSingleThreadExecutor();
        List<Throwable> innerFailures = new ArrayList<>();
        gateway.setDuringTransfer((to, amount) -> {
            Future<OperationOutcome> inner = worker.submit(() -> executor.withdraw(to, amount));
            try {
                inner.get(3, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                innerFailures.add(e.getCause());
            } catch (Exception e) {
                innerFailures.add(e);
            }
        });

        try {
            OperationOutcome outcome = executor.withdraw("alice", Amount.of(100));
            assertEquals(Amount.of(200), outcome.getResultingBalance());
        } finally {
            worker.shutdownNow();
        }

        assertEquals(1, innerFailures.size());
        assertInstanceOf(ReentrancyRejectedException.class, innerFailures.get(0));
        assertEquals(Amount.of(200), ledgerCore.balanceOf("alice"));
        assertEquals(1, ledgerCore.globalStats().getTotalWithdrawOperations());
        assertEquals(1, gateway.getPayouts().size());
        assertEquals(GuardState.IDLE, executor.getGuardState());
    }

    @Test
    void testFailingNotifierDoesNotFailCommittedWithdrawal() {
        executor.deposit("alice", Amount.of(300));
        doThrow(new IllegalStateException("journal unavailable")).when(notifier).onOperationCompleted(any());

        OperationOutcome outcome = executor.withdraw("alice", Amount.of(100));

        assertEquals(OperationType.WITHDRAWAL, outcome.getType());
        assertEquals(Amount.of(200), outcome.getResultingBalance());
        assertEquals(Amount.of(100), gateway.deliveredTo("alice"));
        assertEquals(Amount.of(200), ledgerCore.balanceOf("alice"));
        assertEquals(GuardState.IDLE, executor.getGuardState());
        verify(notifier, times(2)).onOperationCompleted(any());
    }

    @Test
    void testFailingNotifierDoesNotFailCommittedDeposit() {
        doThrow(new IllegalStateException("journal unavailable")).when(notifier).onOperationCompleted(any());

        OperationOutcome outcome = executor.deposit("alice", Amount.of(300));

        assertEquals(Amount.of(300), outcome.getResultingBalance());
        assertEquals(1, ledgerCore.globalStats().getTotalDepositOperations());
    }
}
