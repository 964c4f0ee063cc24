package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.dto.PagedResponse;
import com.nosota.tradeflow.api.response.NotificationResponse;
import com.nosota.tradeflow.api.response.UnreadCountResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of NotificationApi.
 */
@RequiredArgsConstructor
@Slf4j
public class NotificationClient implements NotificationApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<PagedResponse<NotificationResponse>> listNotifications(Long actorId, int page, int size) {
        log.debug("Calling listNotifications: actorId={}, page={}, size={}", actorId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/notifications")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<NotificationResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<UnreadCountResponse> getUnreadCount(Long actorId) {
        return webClient.get()
                .uri("/api/v1/notifications/unread-count")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .retrieve()
                .toEntity(UnreadCountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<NotificationResponse> markRead(UUID notificationId, Long actorId) {
        log.debug("Calling markRead: notificationId={}, actorId={}", notificationId, actorId);

        return webClient.post()
                .uri("/api/v1/notifications/{notificationId}/read", notificationId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .retrieve()
                .toEntity(NotificationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<UnreadCountResponse> markAllRead(Long actorId) {
        log.debug("Calling markAllRead: actorId={}", actorId);

        return webClient.post()
                .uri("/api/v1/notifications/read-all")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .retrieve()
                .toEntity(UnreadCountResponse.class)
                .block();
    }
}
