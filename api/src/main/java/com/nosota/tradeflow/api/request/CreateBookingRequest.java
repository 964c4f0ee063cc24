package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.PaymentMethod;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Request DTO for booking a service. Bookings without a package are custom-quote bookings
 * and need an accepted quote.
 */
public record CreateBookingRequest(
        @NotNull(message = "Service ID is required")
        UUID serviceId,

        UUID packageId,

        @NotNull(message = "Seller ID is required")
        Long sellerId,

        @NotNull(message = "Scheduled date is required")
        LocalDate scheduledDate,

        @Size(max = 20, message = "Scheduled time must be at most 20 characters")
        String scheduledTime,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @Min(value = 1, message = "Quantity must be at least 1")
        Integer quantity,

        @NotNull(message = "Payment method is required")
        PaymentMethod paymentMethod,

        @Size(max = 2000, message = "Notes must be at most 2000 characters")
        String notes,

        UUID conversationId,

        UUID quoteId,

        UUID designApprovalId
) {
}
