package com.custodyledger.rules;

import com.custodyledger.common.Amount;
import com.custodyledger.common.exception.CapacityExceededException;
import com.custodyledger.common.exception.InsufficientBalanceException;
import com.custodyledger.common.exception.RejectionCode;
import com.custodyledger.common.exception.WithdrawLimitExceededException;
import com.custodyledger.ledger.CapacityPolicy;
import com.custodyledger.ledger.LedgerSettings;
import com.custodyledger.ledger.LedgerView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the admissibility rules and their ordering.
 * Ledger state is mocked so each rule sees exactly the numbers under test.
 */
@ExtendWith(MockitoExtension.class)
class RulesEngineTest {

    @Mock
    private LedgerView ledger;

    private RulesEngine rulesEngine;

    @BeforeEach
    void setUp() {
        rulesEngine = RulesEngine.standard();
        lenient().when(ledger.getSettings()).thenReturn(LedgerSettings.builder()
            .capacityLimit(Amount.of(1000))
            .withdrawLimit(Amount.of(100))
            .capacityPolicy(CapacityPolicy.HELD_BALANCE)
            .build());
    }

    @Test
    void testZeroAmountDeclinedFirst() {
        RuleResult deposit = rulesEngine.evaluateRules(OperationRequest.deposit("alice", Amount.ZERO), ledger);
        RuleResult withdrawal = rulesEngine.evaluateRules(OperationRequest.withdrawal("alice", Amount.ZERO), ledger);

        assertFalse(deposit.isApproved());
        assertEquals(RejectionCode.ZERO_AMOUNT, deposit.getRejection().getCode());
        assertEquals(RejectionCode.ZERO_AMOUNT, withdrawal.getRejection().getCode());
        verify(ledger, never()).balanceOf(anyString());
    }

    @Test
    void testCapacityExceededReportsRemaining() {
        when(ledger.getHeldBalance()).thenReturn(Amount.of(600));

        RuleResult result = rulesEngine.evaluateRules(OperationRequest.deposit("bob", Amount.of(500)), ledger);

        assertFalse(result.isApproved());
        CapacityExceededException rejection = (CapacityExceededException) result.getRejection();
        assertEquals(Amount.of(500), rejection.getAttempted());
        assertEquals(Amount.of(400), rejection.getRemainingCapacity());
    }

    @Test
    void testDepositFillingCapacityExactlyApproved() {
        when(ledger.getHeldBalance()).thenReturn(Amount.of(600));

        RuleResult result = rulesEngine.evaluateRules(OperationRequest.deposit("bob", Amount.of(400)), ledger);

        assertTrue(result.isApproved());
        assertNull(result.getRejection());
    }

    @Test
    void testCumulativePolicyIgnoresWithdrawals() {
        when(ledger.getSettings()).thenReturn(LedgerSettings.builder()
            .capacityLimit(Amount.of(1000))
            .withdrawLimit(Amount.of(100))
            .capacityPolicy(CapacityPolicy.CUMULATIVE_DEPOSITS)
            .build());
        when(ledger.getTotalDeposited()).thenReturn(Amount.of(900));

        RuleResult result = rulesEngine.evaluateRules(OperationRequest.deposit("bob", Amount.of(200)), ledger);

        assertFalse(result.isApproved());
        assertEquals(Amount.of(100),
            ((CapacityExceededException) result.getRejection()).getRemainingCapacity());
        verify(ledger, never()).getHeldBalance();
    }

    @Test
    void testWithdrawLimitCheckedBeforeBalance() {
        RuleResult result = rulesEngine.evaluateRules(OperationRequest.withdrawal("alice", Amount.of(150)), ledger);

        assertFalse(result.isApproved());
        WithdrawLimitExceededException rejection = (WithdrawLimitExceededException) result.getRejection();
        assertEquals(Amount.of(150), rejection.getRequested());
        assertEquals(Amount.of(100), rejection.getLimit());
        verify(ledger, never()).balanceOf(anyString());
    }

    @Test
    void testInsufficientBalance() {
        when(ledger.balanceOf("alice")).thenReturn(Amount.of(40));

        RuleResult result = rulesEngine.evaluateRules(OperationRequest.withdrawal("alice", Amount.of(50)), ledger);

        InsufficientBalanceException rejection = (InsufficientBalanceException) result.getRejection();
        assertEquals(Amount.of(40), rejection.getAvailable());
        assertEquals(Amount.of(50), rejection.getRequested());
    }

    @Test
    void testWithdrawalOfWholeBalanceApproved() {
        when(ledger.balanceOf("alice")).thenReturn(Amount.of(100));

        RuleResult result = rulesEngine.evaluateRules(OperationRequest.withdrawal("alice", Amount.of(100)), ledger);

        assertTrue(result.isApproved());
    }

    @Test
    void testDepositSkipsWithdrawalRules() {
        when(ledger.getHeldBalance()).thenReturn(Amount.ZERO);

        RuleResult result = rulesEngine.evaluateRules(OperationRequest.deposit("alice", Amount.of(500)), ledger);

        assertTrue(result.isApproved());
        verify(ledger, never()).balanceOf(anyString());
    }
}
