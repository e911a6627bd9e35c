package com.custodyledger.journal;

import com.custodyledger.ledger.OperationType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Journal record of one completed ledger operation.
 *
 * Entries are written once, after the operation succeeded, and never updated
 * or deleted. Rejected and rolled-back operations leave no entry.
 */
@Entity
@Table(name = "journal_entries", indexes = {
    @Index(name = "idx_journal_principal", columnList = "principal"),
    @Index(name = "idx_journal_occurred_at", columnList = "occurred_at")
})
@Data
@NoArgsConstructor
public class JournalEntry {

    @Id
    private String entryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OperationType operationType;

    @Column(nullable = false)
    private String principal;

    /**
     * Amount moved, in the smallest value unit.
     */
    @Column(name = "amount_units", nullable = false, precision = 38, scale = 0)
    private BigInteger amount;

    /**
     * Principal's balance right after the operation.
     */
    @Column(name = "resulting_balance_units", nullable = false, precision = 38, scale = 0)
    private BigInteger resultingBalance;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    public JournalEntry(OperationType operationType, String principal, BigInteger amount,
                        BigInteger resultingBalance, Instant occurredAt, Instant recordedAt) {
        this.entryId = UUID.randomUUID().toString();
        this.operationType = operationType;
        this.principal = principal;
        this.amount = amount;
        this.resultingBalance = resultingBalance;
        this.occurredAt = occurredAt;
        this.recordedAt = recordedAt;
    }
}
