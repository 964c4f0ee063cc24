package com.nosota.tradeflow.api.socket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.response.MessageResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationSocketClientTest {

    private static final URI ENDPOINT = URI.create("ws://tradeflow.local/ws");

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final List<MessageResponse> delivered = new ArrayList<>();

    @Mock
    private WebSocketClient webSocketClient;

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private WebSocketSession session;

    private ConversationSocketClient client;

    @BeforeEach
    void setUp() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(200), Duration.ofSeconds(5), 2.0, 0);
        client = new ConversationSocketClient(webSocketClient, ENDPOINT, 11L, ActorRole.BUYER, objectMapper,
                scheduler, policy, delivered::add);
    }

    @Test
    void joinBeforeHandshake_isSentOnceConnected() throws Exception {
        UUID conversationId = UUID.randomUUID();
        client.join(conversationId);
        verify(session, never()).sendMessage(any());

        when(session.isOpen()).thenReturn(true);
        client.afterConnectionEstablished(session);

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(sent.capture());
        SocketFrame frame = objectMapper.readValue(sent.getValue().getPayload(), SocketFrame.class);
        assertThat(frame.type()).isEqualTo(SocketFrame.JOIN);
        assertThat(frame.conversationId()).isEqualTo(conversationId);
        assertThat(client.isConnected()).isTrue();
    }

    @Test
    void duplicatePushIsDeliveredOnce() throws Exception {
        UUID conversationId = UUID.randomUUID();
        MessageResponse message = new MessageResponse(UUID.randomUUID(), conversationId, 3L, 12L, ActorRole.SELLER,
                false, "Still available?", List.of(), List.of(12L), LocalDateTime.now());
        TextMessage frame = new TextMessage(objectMapper.writeValueAsString(
                SocketFrame.newMessage(conversationId, message)));

        client.handleTextMessage(session, frame);
        client.handleTextMessage(session, frame);

        assertThat(delivered).hasSize(1);
        assertThat(delivered.get(0).sequenceNumber()).isEqualTo(3L);
    }

    @Test
    void unexpectedClose_schedulesReconnectWithBackoff() {
        client.afterConnectionEstablished(session);
        client.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        verify(scheduler).schedule(any(Runnable.class), eq(200L), eq(TimeUnit.MILLISECONDS));
        assertThat(client.isConnected()).isFalse();
    }

    @Test
    void unauthorizedAndNormalCloses_doNotReconnect() {
        client.afterConnectionClosed(session, new CloseStatus(ConversationSocketClient.UNAUTHORIZED_CLOSE_CODE));
        client.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    void failedConnect_isRetried() {
        when(webSocketClient.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("connection refused")));

        client.connect();

        verify(scheduler).schedule(any(Runnable.class), eq(200L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void closeStopsReconnecting() throws Exception {
        when(session.isOpen()).thenReturn(true);
        client.afterConnectionEstablished(session);

        client.close();
        verify(session).close(CloseStatus.NORMAL);

        client.afterConnectionClosed(session, CloseStatus.GOING_AWAY);
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }
}
