package com.custodyledger.accounts;

import com.custodyledger.common.Amount;
import com.custodyledger.common.PrincipalId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Custody account of a single principal.
 *
 * Created implicitly on the first deposit and never removed; a zero balance is
 * an ordinary state. The ledger is the only writer, so this class carries no
 * locking of its own.
 */
public class Account {

    private final String principal;
    private Amount balance = Amount.ZERO;
    private long depositCount;
    private long withdrawCount;
    private final List<Amount> depositHistory = new ArrayList<>();
    private final List<Amount> withdrawHistory = new ArrayList<>();

    public Account(String principal) {
        this.principal = PrincipalId.validate(principal);
    }

    public String getPrincipal() {
        return principal;
    }

    public Amount getBalance() {
        return balance;
    }

    public long getDepositCount() {
        return depositCount;
    }

    public long getWithdrawCount() {
        return withdrawCount;
    }

    public List<Amount> getDepositHistory() {
        return Collections.unmodifiableList(depositHistory);
    }

    public List<Amount> getWithdrawHistory() {
        return Collections.unmodifiableList(withdrawHistory);
    }

    public void credit(Amount amount) {
        Amount newBalance = balance.add(amount);
        depositCount = Math.addExact(depositCount, 1);
        balance = newBalance;
        depositHistory.add(amount);
    }

    /**
     * @throws ArithmeticException if the debit would take the balance below zero
     */
    public void debit(Amount amount) {
        Amount newBalance = balance.subtract(amount);
        withdrawCount = Math.addExact(withdrawCount, 1);
        balance = newBalance;
        withdrawHistory.add(amount);
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(
            principal,
            balance,
            depositCount,
            withdrawCount,
            depositHistory.size(),
            withdrawHistory.size()
        );
    }

    /**
     * Put the account back into the state captured by {@code snapshot}.
     * Only entries appended after the snapshot are discarded.
     */
    public void restore(AccountSnapshot snapshot) {
        if (!principal.equals(snapshot.getPrincipal())) {
            throw new IllegalArgumentException(
                "Snapshot of " + snapshot.getPrincipal() + " cannot restore account " + principal);
        }
        if (snapshot.getDepositEntries() > depositHistory.size()
                || snapshot.getWithdrawEntries() > withdrawHistory.size()) {
            throw new IllegalStateException("Snapshot is newer than account " + principal);
        }
        balance = snapshot.getBalance();
        depositCount = snapshot.getDepositCount();
        withdrawCount = snapshot.getWithdrawCount();
        depositHistory.subList(snapshot.getDepositEntries(), depositHistory.size()).clear();
        withdrawHistory.subList(snapshot.getWithdrawEntries(), withdrawHistory.size()).clear();
    }
}
