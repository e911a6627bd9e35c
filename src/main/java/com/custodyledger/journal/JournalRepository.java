package com.custodyledger.journal;

import com.custodyledger.ledger.OperationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for journal entries.
 */
@Repository
public interface JournalRepository extends JpaRepository<JournalEntry, String> {

    List<JournalEntry> findAllByOrderByOccurredAtAsc();

    List<JournalEntry> findByPrincipalOrderByOccurredAtAsc(String principal);

    long countByOperationType(OperationType operationType);
}
