package com.nosota.tradeflow.realtime;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationSubscriberRegistryTest {

    private final ConversationSubscriberRegistry registry = new ConversationSubscriberRegistry();

    @Test
    void publishReachesOnlyTheConversationsSubscribers() throws Exception {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        WebSocketSession buyer = session("s1", 1L);
        WebSocketSession seller = session("s2", 2L);
        registry.join(buyer, first);
        registry.join(seller, second);

        int delivered = registry.publish(first, "{\"type\":\"new_message\"}");

        assertThat(delivered).isEqualTo(1);
        verify(buyer).sendMessage(any(TextMessage.class));
        verify(seller, never()).sendMessage(any());
    }

    @Test
    void joiningAnotherConversationMovesTheSession() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        WebSocketSession buyer = session("s1", 1L);

        registry.join(buyer, first);
        registry.join(buyer, second);

        assertThat(registry.subscriberCount(first)).isZero();
        assertThat(registry.subscriberCount(second)).isEqualTo(1);
        assertThat(registry.subscriptionOf(buyer)).isEqualTo(second);
        assertThat(registry.isSubscribed(second, 1L)).isTrue();
        assertThat(registry.isSubscribed(first, 1L)).isFalse();
    }

    @Test
    void failedSendDropsTheSessionWithoutFailingThePublisher() throws Exception {
        UUID conversation = UUID.randomUUID();
        WebSocketSession broken = session("s1", 1L);
        WebSocketSession healthy = session("s2", 2L);
        doThrow(new IOException("broken pipe")).when(broken).sendMessage(any());
        registry.join(broken, conversation);
        registry.join(healthy, conversation);

        int delivered = registry.publish(conversation, "{}");

        assertThat(delivered).isEqualTo(1);
        assertThat(registry.subscriberCount(conversation)).isEqualTo(1);
        assertThat(registry.isSubscribed(conversation, 1L)).isFalse();
    }

    @Test
    void leaveAndPublishToEmptyRoom() {
        UUID conversation = UUID.randomUUID();
        WebSocketSession buyer = session("s1", 1L);
        registry.join(buyer, conversation);

        registry.leave(buyer);

        assertThat(registry.publish(conversation, "{}")).isZero();
        assertThat(registry.subscriptionOf(buyer)).isNull();
    }

    private static WebSocketSession session(String id, Long userId) {
        WebSocketSession session = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        attributes.put(ConversationSubscriberRegistry.USER_ID_ATTRIBUTE, userId);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(attributes);
        return session;
    }
}
