package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.ReturnReason;
import com.nosota.tradeflow.api.model.ReturnRequestStatus;
import com.nosota.tradeflow.api.model.SellerResponseStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One return attempt with its full seller and admin history.
 */
public record ReturnRequestResponse(
        UUID id,
        UUID orderId,
        UUID bookingId,
        Long buyerId,
        Long sellerId,
        int attemptNumber,
        ReturnReason reason,
        String description,
        List<String> evidenceUrls,
        BigDecimal requestedRefundAmount,
        ReturnRequestStatus status,
        SellerResponseStatus sellerStatus,
        String sellerResponse,
        BigDecimal sellerProposedRefundAmount,
        LocalDateTime sellerRespondedAt,
        String adminNotes,
        BigDecimal approvedRefundAmount,
        BigDecimal commissionReversedAmount,
        LocalDateTime underReviewAt,
        LocalDateTime resolvedAt,
        LocalDateTime refundedAt,
        Long version,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
