package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.DesignApprovalStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record DesignApprovalResponse(
        UUID id,
        UUID conversationId,
        Long buyerId,
        Long sellerId,
        UUID productId,
        UUID serviceId,
        UUID variantId,
        UUID packageId,
        UUID quoteId,
        List<DesignFileResponse> designFiles,
        String buyerNotes,
        String sellerNotes,
        DesignApprovalStatus status,
        LocalDateTime reviewedAt,
        LocalDateTime approvedAt,
        Long version,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
