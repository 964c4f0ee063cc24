package com.nosota.tradeflow.api.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Request DTO for creating a quote inside a conversation.
 *
 * <p>A seller creates a priced quote ({@code SENT}, or {@code PENDING} when {@code draft} is
 * set). A buyer opens a {@code REQUESTED} quote without a price.
 *
 * @param conversationId   Conversation the quote belongs to
 * @param productId        Quoted product (exactly one of productId/serviceId)
 * @param serviceId        Quoted service
 * @param productVariantId Optional product variant
 * @param servicePackageId Optional service package
 * @param quotedPrice      Unit price, required for sellers
 * @param quantity         Quantity, at least 1
 * @param specifications   Free-text specification
 * @param expiresAt        Expiry; defaults to the configured validity window
 * @param designApprovalId Optional design approval the quote depends on
 * @param draft            Create as PENDING instead of SENT
 */
public record CreateQuoteRequest(
        @NotNull(message = "Conversation ID is required")
        UUID conversationId,

        UUID productId,

        UUID serviceId,

        UUID productVariantId,

        UUID servicePackageId,

        @Positive(message = "Quoted price must be positive")
        BigDecimal quotedPrice,

        @NotNull(message = "Quantity is required")
        @Min(value = 1, message = "Quantity must be at least 1")
        Integer quantity,

        @Size(max = 4000, message = "Specifications must be at most 4000 characters")
        String specifications,

        LocalDateTime expiresAt,

        UUID designApprovalId,

        boolean draft
) {
}
