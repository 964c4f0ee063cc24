package com.nosota.tradeflow.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record CreateDesignApprovalRequest(
        @NotNull(message = "Conversation ID is required")
        UUID conversationId,

        UUID productId,

        UUID serviceId,

        UUID variantId,

        UUID packageId,

        UUID quoteId,

        @NotEmpty(message = "At least one design file is required")
        @Size(max = 20, message = "At most 20 design files")
        @Valid
        List<DesignFilePayload> designFiles,

        @Size(max = 2000, message = "Notes must be at most 2000 characters")
        String buyerNotes
) {
}
