package com.nosota.tradeflow.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.tradeflow.api.socket.SocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Broadcasts appended messages to the conversation's live connections once the appending
 * transaction has committed. Runs on the broadcast executor; a failure is logged and never
 * reaches the sender.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeEventListener {

    private final ConversationSubscriberRegistry registry;
    private final ObjectMapper objectMapper;

    @Async("broadcastExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onMessageAppended(MessageAppendedEvent event) {
        try {
            String frame = objectMapper.writeValueAsString(SocketFrame.newMessage(event.conversationId(), event.message()));
            int delivered = registry.publish(event.conversationId(), frame);
            log.debug("Message #{} of conversation {} delivered to {} connection(s)",
                    event.message().sequenceNumber(), event.conversationId(), delivered);
        } catch (Exception e) {
            log.error("Failed to broadcast message to conversation {}: {}", event.conversationId(), e.getMessage(), e);
        }
    }
}
