package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.QuoteStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record QuoteResponse(
        UUID id,
        UUID conversationId,
        Long buyerId,
        Long sellerId,
        UUID productId,
        UUID serviceId,
        UUID productVariantId,
        UUID servicePackageId,
        BigDecimal quotedPrice,
        Integer quantity,
        String specifications,
        LocalDateTime expiresAt,
        QuoteStatus status,
        UUID designApprovalId,
        String rejectionReason,
        LocalDateTime acceptedAt,
        Long version,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
