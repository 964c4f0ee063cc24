package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.dto.PagedResponse;
import com.nosota.tradeflow.api.response.NotificationResponse;
import com.nosota.tradeflow.api.response.UnreadCountResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Notification API. Clients poll it; real-time delivery is reserved for conversations.
 *
 * <p>Implemented by NotificationController (service) and NotificationClient (api).
 */
@RequestMapping("/api/v1/notifications")
public interface NotificationApi {

    /**
     * Lists the actor's notifications, most recent first. The page size is capped server-side.
     */
    @GetMapping
    ResponseEntity<PagedResponse<NotificationResponse>> listNotifications(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    @GetMapping("/unread-count")
    ResponseEntity<UnreadCountResponse> getUnreadCount(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId);

    /**
     * Marks one notification read. No-op when it already is.
     */
    @PostMapping("/{notificationId}/read")
    ResponseEntity<NotificationResponse> markRead(
            @PathVariable("notificationId") UUID notificationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId);

    /**
     * Marks all of the actor's notifications read.
     *
     * @return Remaining unread count (always 0)
     */
    @PostMapping("/read-all")
    ResponseEntity<UnreadCountResponse> markAllRead(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId);
}
