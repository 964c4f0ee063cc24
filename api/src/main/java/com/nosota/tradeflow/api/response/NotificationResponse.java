package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.NotificationType;

import java.time.LocalDateTime;
import java.util.UUID;

public record NotificationResponse(
        UUID id,
        Long userId,
        NotificationType type,
        String title,
        String message,
        String link,
        boolean read,
        LocalDateTime createdAt,
        LocalDateTime readAt
) {
}
