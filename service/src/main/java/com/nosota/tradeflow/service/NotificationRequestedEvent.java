package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.NotificationType;

/**
 * Request to notify one user, written once the publishing transaction has committed.
 */
public record NotificationRequestedEvent(
        Long userId,
        NotificationType type,
        String title,
        String message,
        String link
) {
}
