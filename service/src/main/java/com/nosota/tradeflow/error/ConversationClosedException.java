package com.nosota.tradeflow.error;

import com.nosota.tradeflow.api.model.ConversationStatus;
import lombok.Getter;

import java.util.UUID;

@Getter
public class ConversationClosedException extends WorkflowException {

    private final UUID conversationId;
    private final ConversationStatus status;

    public ConversationClosedException(UUID conversationId, ConversationStatus status) {
        super(String.format("Conversation %s is %s and accepts no new messages", conversationId, status));
        this.conversationId = conversationId;
        this.status = status;

        detail("entityType", "CONVERSATION");
        detail("entityId", conversationId);
        detail("currentState", status);
    }
}
