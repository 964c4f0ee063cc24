package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.OrderStatus;
import com.nosota.tradeflow.api.model.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Order details.
 *
 * @param totalAmount    unitPrice x quantity + shippingCost
 * @param readyToShip    Set by the seller while PROCESSING, consumed by admin consolidation
 * @param paymentLink    Hosted payment page for IPG orders
 */
public record OrderResponse(
        UUID id,
        Long buyerId,
        Long sellerId,
        UUID productId,
        UUID productVariantId,
        Integer quantity,
        BigDecimal unitPrice,
        BigDecimal shippingCost,
        BigDecimal totalAmount,
        String shippingAddress,
        OrderStatus status,
        boolean readyToShip,
        String trackingNumber,
        String carrier,
        PaymentMethod paymentMethod,
        String paymentReference,
        String paymentSlipUrl,
        String paymentLink,
        UUID conversationId,
        UUID quoteId,
        UUID designApprovalId,
        int returnAttemptCount,
        LocalDateTime paidAt,
        LocalDateTime shippedAt,
        LocalDateTime deliveredAt,
        LocalDateTime cancelledAt,
        Long version,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
