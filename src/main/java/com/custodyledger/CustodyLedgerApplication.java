package com.custodyledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Custody Ledger.
 *
 * Custody Ledger holds value on behalf of many account holders under a global
 * capacity limit and a per-withdrawal limit, and guarantees that no sequence
 * of operations, including ones that re-enter the ledger during a payout, can
 * corrupt per-account or aggregate balances.
 */
@SpringBootApplication
public class CustodyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CustodyLedgerApplication.class, args);
    }
}
