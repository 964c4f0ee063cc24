package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.dto.PagedResponse;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.request.AppendMessageRequest;
import com.nosota.tradeflow.api.request.CreateConversationRequest;
import com.nosota.tradeflow.api.request.UpdateConversationStatusRequest;
import com.nosota.tradeflow.api.response.ConversationResponse;
import com.nosota.tradeflow.api.response.MessageResponse;
import com.nosota.tradeflow.api.response.UnreadCountResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of ConversationApi. Not a Spring bean; see
 * {@link WorkflowClient} for a registration example.
 */
@RequiredArgsConstructor
@Slf4j
public class ConversationClient implements ConversationApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<ConversationResponse> createConversation(Long actorId, ActorRole actorRole,
                                                                   CreateConversationRequest request) {
        log.debug("Calling createConversation: type={}, buyerId={}, sellerId={}",
                request.type(), request.buyerId(), request.sellerId());

        return webClient.post()
                .uri("/api/v1/conversations")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(ConversationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ConversationResponse> getConversation(UUID conversationId, Long actorId,
                                                                ActorRole actorRole) {
        log.debug("Calling getConversation: conversationId={}", conversationId);

        return webClient.get()
                .uri("/api/v1/conversations/{conversationId}", conversationId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(ConversationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<ConversationResponse>> listConversations(Long actorId, ActorRole actorRole,
                                                                                 int page, int size) {
        log.debug("Calling listConversations: actorId={}, page={}, size={}", actorId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/conversations")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<ConversationResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<MessageResponse> appendMessage(UUID conversationId, Long actorId, ActorRole actorRole,
                                                         AppendMessageRequest request) {
        log.debug("Calling appendMessage: conversationId={}, actorId={}", conversationId, actorId);

        return webClient.post()
                .uri("/api/v1/conversations/{conversationId}/messages", conversationId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(MessageResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<MessageResponse>> listMessages(UUID conversationId, Long actorId, ActorRole actorRole,
                                                              long afterSequence, int limit) {
        log.debug("Calling listMessages: conversationId={}, afterSequence={}, limit={}",
                conversationId, afterSequence, limit);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/conversations/{conversationId}/messages")
                        .queryParam("afterSequence", afterSequence)
                        .queryParam("limit", limit)
                        .build(conversationId))
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<MessageResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<UnreadCountResponse> markRead(UUID conversationId, Long actorId, ActorRole actorRole) {
        log.debug("Calling markRead: conversationId={}, actorId={}", conversationId, actorId);

        return webClient.post()
                .uri("/api/v1/conversations/{conversationId}/read", conversationId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(UnreadCountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<UnreadCountResponse> getUnreadCount(UUID conversationId, Long actorId,
                                                              ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/conversations/{conversationId}/unread-count", conversationId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(UnreadCountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ConversationResponse> updateStatus(UUID conversationId, Long actorId, ActorRole actorRole,
                                                             UpdateConversationStatusRequest request) {
        log.debug("Calling updateStatus: conversationId={}, status={}", conversationId, request.status());

        return webClient.post()
                .uri("/api/v1/conversations/{conversationId}/status", conversationId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(ConversationResponse.class)
                .block();
    }
}
