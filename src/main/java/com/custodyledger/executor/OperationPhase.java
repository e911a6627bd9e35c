package com.custodyledger.executor;

/**
 * Phases a single guarded operation moves through.
 *
 * IDLE -> VALIDATING -> REJECTED
 *                    -> MUTATING -> COMPLETED (deposit)
 *                                -> TRANSFERRING -> COMPLETED
 *                                                -> FAULTED
 *
 * The guard returns to idle after every terminal phase.
 */
public enum OperationPhase {
    IDLE,
    VALIDATING,
    REJECTED,
    MUTATING,
    TRANSFERRING,
    FAULTED,
    COMPLETED
}
