package com.nosota.tradeflow.controller;

import com.nosota.tradeflow.api.ConversationApi;
import com.nosota.tradeflow.api.dto.PagedResponse;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.request.AppendMessageRequest;
import com.nosota.tradeflow.api.request.CreateConversationRequest;
import com.nosota.tradeflow.api.request.UpdateConversationStatusRequest;
import com.nosota.tradeflow.api.response.ConversationResponse;
import com.nosota.tradeflow.api.response.MessageResponse;
import com.nosota.tradeflow.api.response.UnreadCountResponse;
import com.nosota.tradeflow.mapper.ConversationMapper;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.service.ConversationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ConversationController implements ConversationApi {

    private static final ConversationMapper MAPPER = ConversationMapper.INSTANCE;

    private final ConversationService conversationService;

    @Override
    public ResponseEntity<ConversationResponse> createConversation(Long actorId, ActorRole actorRole,
                                                                   CreateConversationRequest request) {
        Conversation conversation = conversationService.createConversation(actorId,
                ExternalActor.require(actorRole), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(conversation));
    }

    @Override
    public ResponseEntity<ConversationResponse> getConversation(UUID conversationId, Long actorId, ActorRole actorRole) {
        Conversation conversation = conversationService.getConversation(conversationId, actorId,
                ExternalActor.require(actorRole));
        return ResponseEntity.ok(MAPPER.toResponse(conversation));
    }

    @Override
    public ResponseEntity<PagedResponse<ConversationResponse>> listConversations(Long actorId, ActorRole actorRole,
                                                                                 int page, int size) {
        Page<Conversation> conversations = conversationService.listConversations(actorId,
                ExternalActor.require(actorRole), page, size);
        PagedResponse<ConversationResponse> response = new PagedResponse<>(
                MAPPER.toResponseList(conversations.getContent()),
                conversations.getNumber(),
                conversations.getSize(),
                conversations.getTotalElements());
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<MessageResponse> appendMessage(UUID conversationId, Long actorId, ActorRole actorRole,
                                                         AppendMessageRequest request) {
        MessageResponse message = conversationService.appendMessage(conversationId, actorId,
                ExternalActor.require(actorRole), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    @Override
    public ResponseEntity<List<MessageResponse>> listMessages(UUID conversationId, Long actorId, ActorRole actorRole,
                                                              long afterSequence, int limit) {
        return ResponseEntity.ok(conversationService.listMessages(conversationId, actorId,
                ExternalActor.require(actorRole), afterSequence, limit));
    }

    @Override
    public ResponseEntity<UnreadCountResponse> markRead(UUID conversationId, Long actorId, ActorRole actorRole) {
        long unread = conversationService.markRead(conversationId, actorId, ExternalActor.require(actorRole));
        return ResponseEntity.ok(new UnreadCountResponse(unread));
    }

    @Override
    public ResponseEntity<UnreadCountResponse> getUnreadCount(UUID conversationId, Long actorId, ActorRole actorRole) {
        long unread = conversationService.unreadCount(conversationId, actorId, ExternalActor.require(actorRole));
        return ResponseEntity.ok(new UnreadCountResponse(unread));
    }

    @Override
    public ResponseEntity<ConversationResponse> updateStatus(UUID conversationId, Long actorId, ActorRole actorRole,
                                                             UpdateConversationStatusRequest request) {
        Conversation conversation = conversationService.updateStatus(conversationId, actorId,
                ExternalActor.require(actorRole), request.status());
        return ResponseEntity.ok(MAPPER.toResponse(conversation));
    }
}
