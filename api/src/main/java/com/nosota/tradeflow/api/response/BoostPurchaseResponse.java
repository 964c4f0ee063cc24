package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.BoostPurchaseStatus;
import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.api.model.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record BoostPurchaseResponse(
        UUID id,
        Long sellerId,
        UUID packageId,
        UUID itemId,
        ItemType itemType,
        PaymentMethod paymentMethod,
        BigDecimal amount,
        String currency,
        BoostPurchaseStatus status,
        String paymentSlipUrl,
        String paymentReference,
        String paymentLink,
        UUID boostedItemId,
        LocalDateTime paidAt,
        Long version,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
