package com.nosota.tradeflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationEventListener {

    private final NotificationService notificationService;

    /**
     * Writes the notification after the business transaction committed. Notifications are
     * advisory: a failure is logged and the committed change stands.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotificationRequested(NotificationRequestedEvent event) {
        try {
            notificationService.create(event);
        } catch (RuntimeException e) {
            log.error("Failed to write {} notification for user {}: {}",
                    event.type(), event.userId(), e.getMessage(), e);
        }
    }
}
