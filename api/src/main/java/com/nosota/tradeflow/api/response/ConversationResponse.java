package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.ConversationStatus;
import com.nosota.tradeflow.api.model.ConversationType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Conversation with its participants and read markers.
 *
 * @param lastSequenceNumber    Sequence number of the latest message, 0 when empty
 * @param resolutionRequestedAt When a buyer or seller last asked an admin to resolve it
 */
public record ConversationResponse(
        UUID id,
        ConversationType type,
        String subject,
        ConversationStatus status,
        Long buyerId,
        Long sellerId,
        UUID productId,
        UUID serviceId,
        UUID orderId,
        UUID bookingId,
        long lastSequenceNumber,
        List<ParticipantResponse> participants,
        LocalDateTime resolutionRequestedAt,
        LocalDateTime lastMessageAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
