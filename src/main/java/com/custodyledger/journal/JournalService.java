package com.custodyledger.journal;

import com.custodyledger.common.exception.NotAuthorizedException;
import com.custodyledger.events.LedgerNotification;
import com.custodyledger.ledger.LedgerSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Records every completed ledger operation in the journal and serves it to
 * the owner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final JournalRepository journalRepository;
    private final LedgerSettings settings;
    private final Clock clock;

    @EventListener
    @Transactional
    public void record(LedgerNotification notification) {
        JournalEntry entry = new JournalEntry(
            notification.getType(),
            notification.getPrincipal(),
            notification.getAmount().getUnits(),
            notification.getResultingBalance().getUnits(),
            notification.getOccurredAt(),
            clock.instant()
        );
        journalRepository.save(entry);

        log.debug("Journaled {}: entry={}, principal={}, amount={}",
            notification.getType(), entry.getEntryId(), notification.getPrincipal(), notification.getAmount());
    }

    /**
     * All journal entries, oldest first. Owner only.
     *
     * @throws NotAuthorizedException if {@code caller} is not the owner
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> getJournal(String caller) {
        if (!settings.isOwner(caller)) {
            throw new NotAuthorizedException(caller, "journal");
        }
        return journalRepository.findAllByOrderByOccurredAtAsc();
    }

    /**
     * Journal entries of one principal, readable by that principal or the owner.
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> getJournal(String caller, String principal) {
        if (caller == null || !(caller.equals(principal) || settings.isOwner(caller))) {
            throw new NotAuthorizedException(caller, principal);
        }
        return journalRepository.findByPrincipalOrderByOccurredAtAsc(principal);
    }
}
