package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.BookingStatus;
import com.nosota.tradeflow.api.model.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

public record BookingResponse(
        UUID id,
        Long buyerId,
        Long sellerId,
        UUID serviceId,
        UUID packageId,
        LocalDate scheduledDate,
        String scheduledTime,
        BigDecimal amount,
        Integer quantity,
        String notes,
        BookingStatus status,
        PaymentMethod paymentMethod,
        String paymentReference,
        String paymentSlipUrl,
        String paymentLink,
        UUID conversationId,
        UUID quoteId,
        UUID designApprovalId,
        int returnAttemptCount,
        LocalDateTime confirmedAt,
        LocalDateTime paidAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        LocalDateTime cancelledAt,
        Long version,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
