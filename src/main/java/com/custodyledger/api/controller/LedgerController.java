package com.custodyledger.api.controller;

import com.custodyledger.api.dto.AccountResponse;
import com.custodyledger.api.dto.AmountRequest;
import com.custodyledger.api.dto.CapacityResponse;
import com.custodyledger.api.dto.HistoryResponse;
import com.custodyledger.api.dto.OperationResponse;
import com.custodyledger.api.dto.StatsResponse;
import com.custodyledger.common.Amount;
import com.custodyledger.custody.CustodyService;
import com.custodyledger.ledger.LedgerSettings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for custody operations.
 *
 * The calling principal is taken from the {@value #CALLER_HEADER} header, which
 * the host environment sets after authenticating the caller.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Custody deposit, withdrawal and query API")
public class LedgerController {

    public static final String CALLER_HEADER = "X-Principal";

    private final CustodyService custodyService;

    @PostMapping("/deposit")
    @Operation(summary = "Deposit value received with this call")
    public ResponseEntity<OperationResponse> deposit(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(OperationResponse.from(
            custodyService.deposit(caller, Amount.of(request.getAmount()))));
    }

    @PostMapping("/inbound")
    @Operation(summary = "Accept an unsolicited inbound transfer as a deposit")
    public ResponseEntity<OperationResponse> inbound(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(OperationResponse.from(
            custodyService.receive(caller, Amount.of(request.getAmount()))));
    }

    @PostMapping("/withdraw")
    @Operation(summary = "Withdraw value to the caller")
    public ResponseEntity<OperationResponse> withdraw(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(OperationResponse.from(
            custodyService.withdraw(caller, Amount.of(request.getAmount()))));
    }

    @GetMapping("/accounts/{principal}/balance")
    @Operation(summary = "Get the balance and counters of an account")
    public ResponseEntity<AccountResponse> getBalance(@PathVariable String principal) {
        return ResponseEntity.ok(AccountResponse.from(custodyService.accountOf(principal)));
    }

    @GetMapping("/accounts/{principal}/history")
    @Operation(summary = "Get past deposit and withdrawal amounts of an account")
    public ResponseEntity<HistoryResponse> getHistory(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String principal) {
        return ResponseEntity.ok(HistoryResponse.from(custodyService.historyOf(caller, principal)));
    }

    @GetMapping("/capacity")
    @Operation(summary = "Get configured limits and remaining capacity")
    public ResponseEntity<CapacityResponse> getCapacity() {
        LedgerSettings settings = custodyService.getSettings();
        return ResponseEntity.ok(CapacityResponse.builder()
            .capacityLimit(settings.getCapacityLimit().getUnits())
            .remainingCapacity(custodyService.remainingCapacity().getUnits())
            .withdrawLimit(settings.getWithdrawLimit().getUnits())
            .capacityPolicy(settings.getCapacityPolicy())
            .build());
    }

    @GetMapping("/stats")
    @Operation(summary = "Get global operation counters and held balance")
    public ResponseEntity<StatsResponse> getStats() {
        return ResponseEntity.ok(StatsResponse.from(custodyService.globalStats(), custodyService.isConserved()));
    }
}
