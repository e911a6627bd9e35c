package com.custodyledger.api.dto;

import com.custodyledger.ledger.GlobalStats;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Aggregate ledger counters.
 */
@Value
@Builder
public class StatsResponse {
    long totalDepositOperations;
    long totalWithdrawOperations;
    BigInteger currentHeldBalance;
    BigInteger totalDeposited;
    BigInteger totalWithdrawn;
    int accountCount;

    /**
     * Whether totals and per-account balances agree.
     */
    boolean conserved;

    public static StatsResponse from(GlobalStats stats, boolean conserved) {
        return StatsResponse.builder()
            .totalDepositOperations(stats.getTotalDepositOperations())
            .totalWithdrawOperations(stats.getTotalWithdrawOperations())
            .currentHeldBalance(stats.getCurrentHeldBalance().getUnits())
            .totalDeposited(stats.getTotalDeposited().getUnits())
            .totalWithdrawn(stats.getTotalWithdrawn().getUnits())
            .accountCount(stats.getAccountCount())
            .conserved(conserved)
            .build();
    }
}
