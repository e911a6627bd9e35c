package com.custodyledger.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes ledger notifications as Spring application events.
 * Listeners run synchronously on the publishing thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringLedgerNotifier implements LedgerNotifier {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void onOperationCompleted(LedgerNotification notification) {
        log.debug("Publishing {} notification for {}", notification.getType(), notification.getPrincipal());
        eventPublisher.publishEvent(notification);
    }
}
