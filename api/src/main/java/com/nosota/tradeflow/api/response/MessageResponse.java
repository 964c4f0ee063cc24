package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.ActorRole;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Conversation message.
 *
 * @param sequenceNumber Monotonic per conversation; clients order and deduplicate by it
 * @param senderId       Sender, null for system messages
 * @param system         True for messages posted by the workflow engine
 * @param readBy         Participants whose read marker has reached this message
 */
public record MessageResponse(
        UUID id,
        UUID conversationId,
        long sequenceNumber,
        Long senderId,
        ActorRole senderRole,
        boolean system,
        String content,
        List<AttachmentResponse> attachments,
        List<Long> readBy,
        LocalDateTime createdAt
) {
}
