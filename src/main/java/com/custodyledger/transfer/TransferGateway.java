package com.custodyledger.transfer;

import com.custodyledger.common.Amount;

/**
 * Outbound side of custody: releases value to an account holder.
 *
 * The ledger calls {@link #transfer} exactly once per accepted withdrawal,
 * after the withdrawal is already reflected in ledger state. An implementation
 * may call back into the ledger while the transfer is running; the ledger
 * rejects such re-entry.
 *
 * Requirements:
 * - MUST return {@code true} only if the value was delivered
 * - MUST return {@code false} or throw if it was not; the ledger then undoes
 *   the withdrawal
 * - MUST NOT retry on its own after reporting failure
 */
public interface TransferGateway {

    /**
     * Deliver {@code amount} to {@code to}.
     *
     * @param to principal receiving the value
     * @param amount value to deliver
     * @return whether the transfer succeeded
     */
    boolean transfer(String to, Amount amount);

    /**
     * Name of this gateway, for logging.
     */
    String getGatewayName();

    /**
     * @return true if the gateway is able to deliver value
     */
    boolean isHealthy();
}
