package com.nosota.tradeflow.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.socket.SocketFrame;
import com.nosota.tradeflow.error.WorkflowException;
import com.nosota.tradeflow.service.ConversationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Real-time conversation channel.
 *
 * <p>A connection carries one user and follows one conversation at a time. Clients send
 * {@code join} frames; everything else flows server to client.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationSocketHandler extends TextWebSocketHandler {

    public static final CloseStatus UNAUTHORIZED = new CloseStatus(4001, "Unauthorized");

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ConversationSubscriberRegistry registry;
    private final ConversationService conversationService;
    private final ObjectMapper objectMapper;

    // Raw session id -> thread-safe decorator used for all sends.
    private final Map<String, WebSocketSession> decorated = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Long userId = (Long) session.getAttributes().get(ConversationSubscriberRegistry.USER_ID_ATTRIBUTE);
        if (userId == null || session.getAttributes().get(ConversationSubscriberRegistry.ROLE_ATTRIBUTE) == null) {
            log.warn("Socket {} has no identity, closing", session.getId());
            session.close(UNAUTHORIZED);
            return;
        }

        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        decorated.put(session.getId(), safe);
        send(safe, SocketFrame.connected(userId));
        log.info("Socket {} connected for user {}", session.getId(), userId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        WebSocketSession safe = decorated.getOrDefault(session.getId(), session);

        SocketFrame frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), SocketFrame.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame on socket {}: {}", session.getId(), e.getOriginalMessage());
            send(safe, SocketFrame.error(null, "Malformed frame"));
            return;
        }

        if (!SocketFrame.JOIN.equals(frame.type())) {
            send(safe, SocketFrame.error(frame.conversationId(), "Unsupported frame type: " + frame.type()));
            return;
        }
        if (frame.conversationId() == null) {
            send(safe, SocketFrame.error(null, "conversationId is required"));
            return;
        }
        join(safe, frame.conversationId());
    }

    private void join(WebSocketSession session, UUID conversationId) throws IOException {
        Long userId = (Long) session.getAttributes().get(ConversationSubscriberRegistry.USER_ID_ATTRIBUTE);
        ActorRole role = (ActorRole) session.getAttributes().get(ConversationSubscriberRegistry.ROLE_ATTRIBUTE);
        try {
            conversationService.requireJoinable(conversationId, userId, role);
        } catch (WorkflowException e) {
            log.warn("Socket {} of user {} refused for conversation {}: {}",
                    session.getId(), userId, conversationId, e.getMessage());
            send(session, SocketFrame.error(conversationId, e.getMessage()));
            return;
        }

        registry.join(session, conversationId);
        send(session, SocketFrame.joined(conversationId));
        log.debug("Socket {} of user {} joined conversation {}", session.getId(), userId, conversationId);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on socket {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSession safe = decorated.remove(session.getId());
        registry.leave(safe != null ? safe : session);
        log.info("Socket {} closed: {}", session.getId(), status);
    }

    private void send(WebSocketSession session, SocketFrame frame) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
    }
}
