package com.nosota.tradeflow.controller;

import com.nosota.tradeflow.api.NotificationApi;
import com.nosota.tradeflow.api.dto.PagedResponse;
import com.nosota.tradeflow.api.response.NotificationResponse;
import com.nosota.tradeflow.api.response.UnreadCountResponse;
import com.nosota.tradeflow.mapper.NotificationMapper;
import com.nosota.tradeflow.model.Notification;
import com.nosota.tradeflow.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class NotificationController implements NotificationApi {

    private final NotificationService notificationService;

    @Override
    public ResponseEntity<PagedResponse<NotificationResponse>> listNotifications(Long actorId, int page, int size) {
        Page<Notification> notifications = notificationService.list(actorId, page, size);
        PagedResponse<NotificationResponse> response = new PagedResponse<>(
                NotificationMapper.INSTANCE.toResponseList(notifications.getContent()),
                notifications.getNumber(),
                notifications.getSize(),
                notifications.getTotalElements());
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<UnreadCountResponse> getUnreadCount(Long actorId) {
        return ResponseEntity.ok(new UnreadCountResponse(notificationService.unreadCount(actorId)));
    }

    @Override
    public ResponseEntity<NotificationResponse> markRead(UUID notificationId, Long actorId) {
        Notification notification = notificationService.markRead(notificationId, actorId);
        return ResponseEntity.ok(NotificationMapper.INSTANCE.toResponse(notification));
    }

    @Override
    public ResponseEntity<UnreadCountResponse> markAllRead(Long actorId) {
        return ResponseEntity.ok(new UnreadCountResponse(notificationService.markAllRead(actorId)));
    }
}
