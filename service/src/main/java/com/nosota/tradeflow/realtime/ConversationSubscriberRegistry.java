package com.nosota.tradeflow.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Live connections per conversation.
 *
 * <p>A connection is subscribed to at most one conversation; joining another one moves it.
 * Delivery is at-most-once: a connection that is not in the set when a message is published
 * gets nothing and catches up by fetching history. Send failures are logged and the broken
 * connection is dropped; they are never propagated to the publisher.
 *
 * <p>Sessions must be thread-safe for concurrent sends (wrapped in
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}).
 */
@Component
@Slf4j
public class ConversationSubscriberRegistry {

    public static final String USER_ID_ATTRIBUTE = "actorId";
    public static final String ROLE_ATTRIBUTE = "actorRole";

    private final Map<UUID, Set<WebSocketSession>> rooms = new ConcurrentHashMap<>();
    private final Map<String, UUID> subscriptions = new ConcurrentHashMap<>();

    public void join(WebSocketSession session, UUID conversationId) {
        UUID previous = subscriptions.put(session.getId(), conversationId);
        if (previous != null && !previous.equals(conversationId)) {
            removeFromRoom(previous, session);
        }
        rooms.computeIfAbsent(conversationId, id -> new CopyOnWriteArraySet<>()).add(session);
        log.debug("Session {} joined conversation {}", session.getId(), conversationId);
    }

    public void leave(WebSocketSession session) {
        UUID conversationId = subscriptions.remove(session.getId());
        if (conversationId != null) {
            removeFromRoom(conversationId, session);
            log.debug("Session {} left conversation {}", session.getId(), conversationId);
        }
    }

    /**
     * Sends a frame to every connection currently subscribed to the conversation.
     *
     * @return number of connections the frame was written to
     */
    public int publish(UUID conversationId, String frame) {
        Set<WebSocketSession> sessions = rooms.get(conversationId);
        if (sessions == null || sessions.isEmpty()) {
            return 0;
        }
        TextMessage message = new TextMessage(frame);
        int delivered = 0;
        for (WebSocketSession session : sessions) {
            if (!session.isOpen()) {
                leave(session);
                continue;
            }
            try {
                session.sendMessage(message);
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.warn("Dropping session {} of conversation {} after failed send: {}",
                        session.getId(), conversationId, e.getMessage());
                leave(session);
            }
        }
        return delivered;
    }

    public boolean isSubscribed(UUID conversationId, Long userId) {
        Set<WebSocketSession> sessions = rooms.get(conversationId);
        if (sessions == null || userId == null) {
            return false;
        }
        return sessions.stream()
                .filter(WebSocketSession::isOpen)
                .anyMatch(s -> Objects.equals(userId, s.getAttributes().get(USER_ID_ATTRIBUTE)));
    }

    public UUID subscriptionOf(WebSocketSession session) {
        return subscriptions.get(session.getId());
    }

    public int subscriberCount(UUID conversationId) {
        Set<WebSocketSession> sessions = rooms.get(conversationId);
        return sessions == null ? 0 : sessions.size();
    }

    private void removeFromRoom(UUID conversationId, WebSocketSession session) {
        rooms.computeIfPresent(conversationId, (id, sessions) -> {
            sessions.removeIf(s -> s.getId().equals(session.getId()));
            return sessions.isEmpty() ? null : sessions;
        });
    }
}
