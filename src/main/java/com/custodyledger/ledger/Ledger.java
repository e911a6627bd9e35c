package com.custodyledger.ledger;

import com.custodyledger.accounts.Account;
import com.custodyledger.common.Amount;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Custody state of one ledger instance.
 *
 * Constructed once with its settings and handed to the components that operate
 * on it. Mutators are package-private; {@link LedgerCore} decides when they may
 * run.
 */
public class Ledger implements LedgerView {

    private final LedgerSettings settings;
    private final Map<String, Account> accounts = new LinkedHashMap<>();

    private Amount totalDeposited = Amount.ZERO;
    private Amount totalWithdrawn = Amount.ZERO;
    private Amount heldBalance = Amount.ZERO;
    private long totalDepositOperations;
    private long totalWithdrawOperations;

    public Ledger(LedgerSettings settings) {
        this.settings = settings;
    }

    @Override
    public LedgerSettings getSettings() {
        return settings;
    }

    @Override
    public Amount balanceOf(String principal) {
        Account account = accounts.get(principal);
        return account != null ? account.getBalance() : Amount.ZERO;
    }

    @Override
    public Amount getHeldBalance() {
        return heldBalance;
    }

    @Override
    public Amount getTotalDeposited() {
        return totalDeposited;
    }

    @Override
    public Amount getTotalWithdrawn() {
        return totalWithdrawn;
    }

    public long getTotalDepositOperations() {
        return totalDepositOperations;
    }

    public long getTotalWithdrawOperations() {
        return totalWithdrawOperations;
    }

    public int getAccountCount() {
        return accounts.size();
    }

    public Optional<Account> findAccount(String principal) {
        return Optional.ofNullable(accounts.get(principal));
    }

    /**
     * Sum of balances recomputed from the accounts rather than the running total.
     */
    public Amount sumOfBalances() {
        Amount sum = Amount.ZERO;
        for (Account account : accounts.values()) {
            sum = sum.add(account.getBalance());
        }
        return sum;
    }

    Account credit(String principal, Amount amount) {
        Account account = accounts.computeIfAbsent(principal, Account::new);
        Amount newTotalDeposited = totalDeposited.add(amount);
        Amount newHeld = heldBalance.add(amount);
        long newOperations = Math.addExact(totalDepositOperations, 1);

        account.credit(amount);
        totalDeposited = newTotalDeposited;
        heldBalance = newHeld;
        totalDepositOperations = newOperations;
        return account;
    }

    Account debit(String principal, Amount amount) {
        Account account = accounts.get(principal);
        if (account == null) {
            throw new ArithmeticException("Amount underflow: no balance held for " + principal);
        }
        // Compute everything that can fail before touching any field.
        Amount newHeld = heldBalance.subtract(amount);
        Amount newTotalWithdrawn = totalWithdrawn.add(amount);
        long newOperations = Math.addExact(totalWithdrawOperations, 1);

        account.debit(amount);
        heldBalance = newHeld;
        totalWithdrawn = newTotalWithdrawn;
        totalWithdrawOperations = newOperations;
        return account;
    }

    LedgerCheckpoint checkpoint(String principal) {
        Account account = accounts.get(principal);
        return new LedgerCheckpoint(
            principal,
            account != null ? account.snapshot() : null,
            totalDeposited,
            totalWithdrawn,
            heldBalance,
            totalDepositOperations,
            totalWithdrawOperations
        );
    }

    void restore(LedgerCheckpoint checkpoint) {
        String principal = checkpoint.getPrincipal();
        if (checkpoint.getAccount() == null) {
            accounts.remove(principal);
        } else {
            Account account = accounts.get(principal);
            if (account == null) {
                throw new IllegalStateException("Account vanished since checkpoint: " + principal);
            }
            account.restore(checkpoint.getAccount());
        }
        totalDeposited = checkpoint.getTotalDeposited();
        totalWithdrawn = checkpoint.getTotalWithdrawn();
        heldBalance = checkpoint.getHeldBalance();
        totalDepositOperations = checkpoint.getTotalDepositOperations();
        totalWithdrawOperations = checkpoint.getTotalWithdrawOperations();
    }
}
