package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.ConversationStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateConversationStatusRequest(
        @NotNull(message = "Status is required")
        ConversationStatus status
) {
}
