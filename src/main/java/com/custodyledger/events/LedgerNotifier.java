package com.custodyledger.events;

/**
 * Receives notifications of completed operations.
 */
public interface LedgerNotifier {

    void onOperationCompleted(LedgerNotification notification);
}
