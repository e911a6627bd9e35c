package com.custodyledger.config;

import com.custodyledger.common.Amount;
import com.custodyledger.executor.OperationGuard;
import com.custodyledger.ledger.CapacityPolicy;
import com.custodyledger.ledger.Ledger;
import com.custodyledger.ledger.LedgerSettings;
import com.custodyledger.transfer.InMemoryTransferGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the single ledger instance of this process.
 *
 * The ledger and its guard are created once here and handed to the services
 * that operate on them; nothing else constructs ledger state.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public LedgerSettings ledgerSettings(
            @Value("${custody-ledger.capacity-limit}") BigInteger capacityLimit,
            @Value("${custody-ledger.withdraw-limit}") BigInteger withdrawLimit,
            @Value("${custody-ledger.strict-withdraw-limit:true}") boolean strictWithdrawLimit,
            @Value("${custody-ledger.capacity-policy:HELD_BALANCE}") CapacityPolicy capacityPolicy,
            @Value("${custody-ledger.owner:}") String owner) {

        LedgerSettings settings = LedgerSettings.builder()
            .capacityLimit(Amount.of(capacityLimit))
            .withdrawLimit(Amount.of(withdrawLimit))
            .strictWithdrawLimit(strictWithdrawLimit)
            .capacityPolicy(capacityPolicy)
            .owner(owner)
            .build();

        log.info("Ledger configured: capacityLimit={}, withdrawLimit={}, strict={}, policy={}, owner={}",
            settings.getCapacityLimit(), settings.getWithdrawLimit(), settings.isStrictWithdrawLimit(),
            settings.getCapacityPolicy(), settings.getOwner() != null ? settings.getOwner() : "<none>");
        return settings;
    }

    @Bean
    public Ledger ledger(LedgerSettings ledgerSettings) {
        return new Ledger(ledgerSettings);
    }

    @Bean
    public OperationGuard operationGuard(
            @Value("${custody-ledger.guard.acquire-timeout:PT2S}") Duration acquireTimeout) {
        return new OperationGuard(acquireTimeout);
    }

    @Bean
    public InMemoryTransferGateway transferGateway(
            @Value("${custody-ledger.transfer.fail-closed:false}") boolean failClosed) {
        if (failClosed) {
            log.warn("In-memory transfer gateway starts fail-closed; every withdrawal will be rolled back");
        }
        return new InMemoryTransferGateway(!failClosed);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
