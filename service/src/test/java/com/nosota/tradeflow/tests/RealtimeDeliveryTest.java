package com.nosota.tradeflow.tests;

import com.nosota.tradeflow.TestBase;
import com.nosota.tradeflow.api.ActorHeaders;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ConversationType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.request.AppendMessageRequest;
import com.nosota.tradeflow.api.request.CreateConversationRequest;
import com.nosota.tradeflow.api.socket.SocketFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Messages reach a subscribed socket over a real connection.
 */
public class RealtimeDeliveryTest extends TestBase {

    @LocalServerPort
    private int port;

    private final BlockingQueue<SocketFrame> frames = new LinkedBlockingQueue<>();
    private final BlockingQueue<CloseStatus> closes = new LinkedBlockingQueue<>();

    private Long buyerId;
    private Long sellerId;
    private UUID conversationId;
    private WebSocketSession socket;

    @BeforeEach
    public void openConversation() {
        buyerId = newUserId();
        sellerId = newUserId();
        conversationId = conversationService.createConversation(buyerId, ActorRole.BUYER,
                new CreateConversationRequest(ConversationType.GENERAL_INQUIRY, "Opening hours", buyerId, sellerId,
                        null, null, null, null)).getId();
    }

    @AfterEach
    public void closeSocket() throws Exception {
        if (socket != null && socket.isOpen()) {
            socket.close();
        }
    }

    @Test
    public void joinedSellerReceivesBuyerMessage() throws Exception {
        socket = connect(sellerId, "SELLER");
        assertThat(nextFrame().type()).isEqualTo(SocketFrame.CONNECTED);

        socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(SocketFrame.join(conversationId))));
        assertThat(nextFrame().type()).isEqualTo(SocketFrame.JOINED);

        conversationService.appendMessage(conversationId, buyerId, ActorRole.BUYER,
                new AppendMessageRequest("Are you open on Sunday?", null));

        SocketFrame pushed = nextFrame();
        assertThat(pushed.type()).isEqualTo(SocketFrame.NEW_MESSAGE);
        assertThat(pushed.conversationId()).isEqualTo(conversationId);
        assertThat(pushed.message().content()).isEqualTo("Are you open on Sunday?");
        assertThat(pushed.message().sequenceNumber()).isEqualTo(1L);

        // Watching the conversation live, so no inbox notification
        assertThat(notificationTypesOf(sellerId)).doesNotContain(NotificationType.MESSAGE_RECEIVED);
    }

    @Test
    public void outsiderCannotJoin() throws Exception {
        socket = connect(newUserId(), "SELLER");
        assertThat(nextFrame().type()).isEqualTo(SocketFrame.CONNECTED);

        socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(SocketFrame.join(conversationId))));

        SocketFrame refused = nextFrame();
        assertThat(refused.type()).isEqualTo(SocketFrame.ERROR);
        assertThat(refused.conversationId()).isEqualTo(conversationId);
    }

    @Test
    public void anonymousSocketIsClosedWith4001() throws Exception {
        socket = new StandardWebSocketClient()
                .execute(new FrameCollector(), new WebSocketHttpHeaders(), URI.create("ws://localhost:" + port + "/ws"))
                .get(5, TimeUnit.SECONDS);

        CloseStatus status = closes.poll(5, TimeUnit.SECONDS);
        assertThat(status).isNotNull();
        assertThat(status.getCode()).isEqualTo(4001);
    }

    private WebSocketSession connect(Long userId, String role) throws Exception {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add(ActorHeaders.ACTOR_ID, userId.toString());
        headers.add(ActorHeaders.ACTOR_ROLE, role);
        return new StandardWebSocketClient()
                .execute(new FrameCollector(), headers, URI.create("ws://localhost:" + port + "/ws"))
                .get(5, TimeUnit.SECONDS);
    }

    private SocketFrame nextFrame() throws InterruptedException {
        SocketFrame frame = frames.poll(5, TimeUnit.SECONDS);
        assertThat(frame).as("frame within 5s").isNotNull();
        return frame;
    }

    private class FrameCollector extends TextWebSocketHandler {

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
            frames.add(objectMapper.readValue(message.getPayload(), SocketFrame.class));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closes.add(status);
        }
    }
}
