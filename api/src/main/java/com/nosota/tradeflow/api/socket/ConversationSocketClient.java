package com.nosota.tradeflow.api.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.tradeflow.api.ActorHeaders;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.response.MessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Client side of the real-time conversation channel.
 *
 * <p>Behaviour:
 * <ul>
 *   <li>{@link #join(UUID)} before the handshake completes is remembered and sent once the
 *       connection opens</li>
 *   <li>an unexpected close (anything but 1000 or the 4001 reject) schedules a reconnect
 *       following the {@link ReconnectPolicy}; after reconnecting the current conversation is
 *       joined again</li>
 *   <li>pushed messages whose id was already delivered are dropped</li>
 * </ul>
 *
 * <p>Delivery is at-most-once. After a reconnect, consumers fetch the messages they missed
 * through the conversation history endpoint using the last sequence number they hold.
 *
 * <p>Not a Spring bean; create one per logical user session.
 */
@Slf4j
public class ConversationSocketClient extends TextWebSocketHandler {

    public static final int UNAUTHORIZED_CLOSE_CODE = 4001;

    private static final int DEDUP_WINDOW = 1000;

    private final WebSocketClient webSocketClient;
    private final URI endpoint;
    private final WebSocketHttpHeaders headers;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final ReconnectPolicy reconnectPolicy;
    private final Consumer<MessageResponse> messageListener;

    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final Set<UUID> deliveredMessageIds = Collections.synchronizedSet(
            Collections.newSetFromMap(new LinkedHashMap<UUID, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<UUID, Boolean> eldest) {
                    return size() > DEDUP_WINDOW;
                }
            }));

    private volatile WebSocketSession session;
    private volatile UUID currentConversationId;
    private volatile boolean stopped;

    public ConversationSocketClient(WebSocketClient webSocketClient,
                                    URI endpoint,
                                    Long actorId,
                                    ActorRole actorRole,
                                    ObjectMapper objectMapper,
                                    ScheduledExecutorService scheduler,
                                    ReconnectPolicy reconnectPolicy,
                                    Consumer<MessageResponse> messageListener) {
        this.webSocketClient = webSocketClient;
        this.endpoint = endpoint;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.reconnectPolicy = reconnectPolicy;
        this.messageListener = messageListener;
        this.headers = new WebSocketHttpHeaders();
        this.headers.add(ActorHeaders.ACTOR_ID, String.valueOf(actorId));
        this.headers.add(ActorHeaders.ACTOR_ROLE, actorRole.name());
    }

    /**
     * Opens the connection. Failures to connect are retried like an unexpected close.
     */
    public CompletableFuture<WebSocketSession> connect() {
        stopped = false;
        log.debug("Connecting to {}", endpoint);
        return webSocketClient.execute(this, headers, endpoint)
                .whenComplete((openedSession, ex) -> {
                    if (ex != null) {
                        log.warn("Connection to {} failed: {}", endpoint, ex.getMessage());
                        scheduleReconnect();
                    }
                });
    }

    /**
     * Subscribes to a conversation, replacing the previous one.
     */
    public void join(UUID conversationId) {
        currentConversationId = conversationId;
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            sendJoin(current, conversationId);
        } else {
            log.debug("Connection not open yet, join to {} queued", conversationId);
        }
    }

    /**
     * Closes the connection normally and stops reconnecting.
     */
    public void close() {
        stopped = true;
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Failed to close connection: {}", e.getMessage());
            }
        }
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    public UUID getCurrentConversationId() {
        return currentConversationId;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        this.session = session;
        reconnectAttempts.set(0);
        log.info("Connected to {}", endpoint);

        UUID conversationId = currentConversationId;
        if (conversationId != null) {
            sendJoin(session, conversationId);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        SocketFrame frame = objectMapper.readValue(message.getPayload(), SocketFrame.class);
        if (frame.type() == null) {
            log.warn("Frame without type ignored");
            return;
        }

        switch (frame.type()) {
            case SocketFrame.NEW_MESSAGE -> deliver(frame);
            case SocketFrame.JOINED -> log.debug("Joined conversation {}", frame.conversationId());
            case SocketFrame.CONNECTED -> log.debug("Server acknowledged user {}", frame.userId());
            case SocketFrame.ERROR -> log.warn("Server error for conversation {}: {}",
                    frame.conversationId(), frame.reason());
            default -> log.debug("Ignoring frame of type {}", frame.type());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        this.session = null;

        if (stopped) {
            log.debug("Connection closed after stop: {}", status);
            return;
        }
        if (status.getCode() == CloseStatus.NORMAL.getCode()) {
            log.info("Connection closed normally");
            return;
        }
        if (status.getCode() == UNAUTHORIZED_CLOSE_CODE) {
            log.warn("Connection rejected as unauthorized, not reconnecting");
            return;
        }

        log.warn("Connection closed unexpectedly: {}", status);
        scheduleReconnect();
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error: {}", exception.getMessage());
    }

    private void deliver(SocketFrame frame) {
        MessageResponse message = frame.message();
        if (message == null || message.id() == null) {
            return;
        }
        if (!deliveredMessageIds.add(message.id())) {
            log.debug("Duplicate push for message {} dropped", message.id());
            return;
        }
        messageListener.accept(message);
    }

    private void sendJoin(WebSocketSession target, UUID conversationId) {
        try {
            String payload = objectMapper.writeValueAsString(SocketFrame.join(conversationId));
            target.sendMessage(new TextMessage(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize join frame", e);
        } catch (IOException e) {
            log.warn("Failed to send join for conversation {}: {}", conversationId, e.getMessage());
        }
    }

    private void scheduleReconnect() {
        if (stopped) {
            return;
        }
        int attempt = reconnectAttempts.incrementAndGet();
        if (reconnectPolicy.isExhausted(attempt)) {
            log.error("Giving up reconnecting to {} after {} attempts", endpoint, attempt - 1);
            return;
        }
        long delayMillis = reconnectPolicy.delayFor(attempt).toMillis();
        log.info("Reconnecting to {} in {} ms (attempt {})", endpoint, delayMillis, attempt);
        scheduler.schedule(() -> {
            connect();
        }, delayMillis, TimeUnit.MILLISECONDS);
    }
}
