package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.dto.PagedResponse;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.request.AppendMessageRequest;
import com.nosota.tradeflow.api.request.CreateConversationRequest;
import com.nosota.tradeflow.api.request.UpdateConversationStatusRequest;
import com.nosota.tradeflow.api.response.ConversationResponse;
import com.nosota.tradeflow.api.response.MessageResponse;
import com.nosota.tradeflow.api.response.UnreadCountResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Conversation API: threads between buyer, seller and admins scoped to a commerce context.
 *
 * <p>Implemented by ConversationController (service) and ConversationClient (api).
 */
@RequestMapping("/api/v1/conversations")
public interface ConversationApi {

    /**
     * Opens a conversation. For pre-purchase types an existing active conversation for the
     * same buyer and item is returned instead of creating a duplicate.
     */
    @PostMapping
    ResponseEntity<ConversationResponse> createConversation(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateConversationRequest request);

    @GetMapping("/{conversationId}")
    ResponseEntity<ConversationResponse> getConversation(
            @PathVariable("conversationId") UUID conversationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    /**
     * Lists conversations the actor participates in, most recently active first.
     * Admins see all conversations.
     */
    @GetMapping
    ResponseEntity<PagedResponse<ConversationResponse>> listConversations(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    /**
     * Appends a message. Rejected with 409 when the conversation is resolved or archived,
     * unless the sender is an admin.
     *
     * @return The stored message with its sequence number
     */
    @PostMapping("/{conversationId}/messages")
    ResponseEntity<MessageResponse> appendMessage(
            @PathVariable("conversationId") UUID conversationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid AppendMessageRequest request);

    /**
     * Returns message history in sequence order. Clients backfill after a reconnect by
     * passing the last sequence number they hold.
     *
     * @param afterSequence Only messages with a greater sequence number
     * @param limit         Maximum number of messages
     */
    @GetMapping("/{conversationId}/messages")
    ResponseEntity<List<MessageResponse>> listMessages(
            @PathVariable("conversationId") UUID conversationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestParam(name = "afterSequence", defaultValue = "0") long afterSequence,
            @RequestParam(name = "limit", defaultValue = "100") int limit);

    /**
     * Moves the actor's read marker to the latest message. Idempotent.
     */
    @PostMapping("/{conversationId}/read")
    ResponseEntity<UnreadCountResponse> markRead(
            @PathVariable("conversationId") UUID conversationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    @GetMapping("/{conversationId}/unread-count")
    ResponseEntity<UnreadCountResponse> getUnreadCount(
            @PathVariable("conversationId") UUID conversationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    /**
     * Changes conversation status. Admins may resolve or archive; a buyer or seller asking
     * for RESOLVED only records a resolution request.
     */
    @PostMapping("/{conversationId}/status")
    ResponseEntity<ConversationResponse> updateStatus(
            @PathVariable("conversationId") UUID conversationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid UpdateConversationStatusRequest request);
}
