package com.custodyledger.transfer;

import com.custodyledger.common.Amount;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Transfer gateway that settles payouts in memory.
 *
 * Stands in for the host environment's value transfer. It keeps the amount
 * delivered to each principal and can be told to refuse transfers or to run a
 * callback in the middle of a transfer, which is how re-entry is exercised.
 */
@Slf4j
public class InMemoryTransferGateway implements TransferGateway {

    // principal -> total delivered
    private final Map<String, Amount> delivered = new ConcurrentHashMap<>();

    private final List<Payout> payouts = Collections.synchronizedList(new ArrayList<>());

    private volatile boolean healthy;

    private volatile BiConsumer<String, Amount> duringTransfer;

    public InMemoryTransferGateway() {
        this(true);
    }

    public InMemoryTransferGateway(boolean healthy) {
        this.healthy = healthy;
    }

    @Override
    public boolean transfer(String to, Amount amount) {
        log.debug("In-memory transfer of {} to {}", amount, to);

        BiConsumer<String, Amount> callback = duringTransfer;
        if (callback != null) {
            callback.accept(to, amount);
        }

        if (!healthy) {
            log.warn("In-memory gateway refused transfer of {} to {}", amount, to);
            return false;
        }

        delivered.merge(to, amount, Amount::add);
        payouts.add(new Payout(to, amount));
        return true;
    }

    @Override
    public String getGatewayName() {
        return "InMemory";
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    /**
     * Set health status; an unhealthy gateway refuses every transfer.
     */
    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    /**
     * Run {@code callback} inside every transfer, before it settles.
     * Pass {@code null} to remove it.
     */
    public void setDuringTransfer(BiConsumer<String, Amount> callback) {
        this.duringTransfer = callback;
    }

    public Amount deliveredTo(String principal) {
        return delivered.getOrDefault(principal, Amount.ZERO);
    }

    public List<Payout> getPayouts() {
        synchronized (payouts) {
            return List.copyOf(payouts);
        }
    }

    /**
     * Clear all state (for test cleanup).
     */
    public void reset() {
        delivered.clear();
        payouts.clear();
        healthy = true;
        duringTransfer = null;
    }

    /**
     * One settled transfer.
     */
    public static final class Payout {
        private final String to;
        private final Amount amount;

        Payout(String to, Amount amount) {
            this.to = to;
            this.amount = amount;
        }

        public String getTo() {
            return to;
        }

        public Amount getAmount() {
            return amount;
        }
    }
}
