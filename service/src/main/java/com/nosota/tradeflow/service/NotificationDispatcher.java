package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Entry point for notifying a user about a business event.
 *
 * <p>The notification is only written after the business transaction commits (see
 * {@link NotificationEventListener}), so a rolled-back change never leaves a notification
 * behind and a failing notification never rolls the change back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final ApplicationEventPublisher eventPublisher;

    public void dispatch(Long userId, NotificationType type, String title, String message, String link) {
        if (userId == null) {
            return;
        }
        log.debug("Queueing {} notification for user {}", type, userId);
        eventPublisher.publishEvent(new NotificationRequestedEvent(userId, type, title, message, link));
    }
}
