package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.PaymentMethod;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for placing an order.
 *
 * <p>When {@code quoteId} is set the quote's seller, unit price and quantity win over the
 * values in the request.
 */
public record CreateOrderRequest(
        @NotNull(message = "Product ID is required")
        UUID productId,

        UUID productVariantId,

        @NotNull(message = "Seller ID is required")
        Long sellerId,

        @NotNull(message = "Quantity is required")
        @Min(value = 1, message = "Quantity must be at least 1")
        Integer quantity,

        @NotNull(message = "Unit price is required")
        @Positive(message = "Unit price must be positive")
        BigDecimal unitPrice,

        @PositiveOrZero(message = "Shipping cost must not be negative")
        BigDecimal shippingCost,

        @NotBlank(message = "Shipping address is required")
        @Size(max = 1000, message = "Shipping address must be at most 1000 characters")
        String shippingAddress,

        @NotNull(message = "Payment method is required")
        PaymentMethod paymentMethod,

        UUID conversationId,

        UUID quoteId,

        UUID designApprovalId
) {
}
