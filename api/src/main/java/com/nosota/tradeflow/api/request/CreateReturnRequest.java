package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.ReturnReason;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Request DTO for filing a return attempt against exactly one order or booking.
 *
 * @param orderId               Order being returned
 * @param bookingId             Booking being disputed
 * @param reason                Return reason
 * @param description           Description, 10 to 2000 characters
 * @param evidenceUrls          Up to 5 evidence file URLs
 * @param requestedRefundAmount Amount the buyer asks for
 */
public record CreateReturnRequest(
        UUID orderId,

        UUID bookingId,

        @NotNull(message = "Reason is required")
        ReturnReason reason,

        @NotBlank(message = "Description is required")
        @Size(min = 10, max = 2000, message = "Description must be between 10 and 2000 characters")
        String description,

        @Size(max = 5, message = "At most 5 evidence files")
        List<@NotBlank(message = "Evidence URL must not be blank") String> evidenceUrls,

        @NotNull(message = "Requested refund amount is required")
        @Positive(message = "Requested refund amount must be positive")
        BigDecimal requestedRefundAmount
) {
}
