package com.custodyledger.api.controller;

import com.custodyledger.journal.JournalEntry;
import com.custodyledger.journal.JournalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the journal of completed operations.
 */
@RestController
@RequestMapping("/api/v1/journal")
@RequiredArgsConstructor
@Tag(name = "Journal", description = "Completed operation journal")
public class JournalController {

    private final JournalService journalService;

    @GetMapping
    @Operation(summary = "Get the full journal (owner only)")
    public ResponseEntity<List<JournalEntry>> getJournal(
            @RequestHeader(LedgerController.CALLER_HEADER) String caller) {
        return ResponseEntity.ok(journalService.getJournal(caller));
    }

    @GetMapping("/{principal}")
    @Operation(summary = "Get journal entries of one principal")
    public ResponseEntity<List<JournalEntry>> getPrincipalJournal(
            @RequestHeader(LedgerController.CALLER_HEADER) String caller,
            @PathVariable String principal) {
        return ResponseEntity.ok(journalService.getJournal(caller, principal));
    }
}
