package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.PaymentOutcome;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Payment gateway callback.
 *
 * @param referenceId    Reference handed out when the payment session was requested
 * @param outcome        SUCCESS or FAILURE
 * @param transactionRef Gateway transaction reference
 */
public record PaymentResultRequest(
        @NotNull(message = "Reference ID is required")
        UUID referenceId,

        @NotNull(message = "Outcome is required")
        PaymentOutcome outcome,

        @Size(max = 255, message = "Transaction reference must be at most 255 characters")
        String transactionRef
) {
}
