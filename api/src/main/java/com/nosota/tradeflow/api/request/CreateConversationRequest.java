package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.ConversationType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Request DTO for opening a conversation.
 *
 * <p>Pre-purchase conversations carry exactly one of productId/serviceId matching their
 * type; ORDER and BOOKING conversations carry the matching orderId/bookingId.
 */
public record CreateConversationRequest(
        @NotNull(message = "Conversation type is required")
        ConversationType type,

        @Size(max = 255, message = "Subject must be at most 255 characters")
        String subject,

        @NotNull(message = "Buyer ID is required")
        Long buyerId,

        Long sellerId,

        UUID productId,

        UUID serviceId,

        UUID orderId,

        UUID bookingId
) {
}
