package com.custodyledger.executor;

/**
 * State of the operation guard.
 */
public enum GuardState {
    IDLE,
    IN_PROGRESS
}
