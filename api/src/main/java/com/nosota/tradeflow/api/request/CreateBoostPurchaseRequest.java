package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.api.model.PaymentMethod;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record CreateBoostPurchaseRequest(
        @NotNull(message = "Package ID is required")
        UUID packageId,

        @NotNull(message = "Item ID is required")
        UUID itemId,

        @NotNull(message = "Item type is required")
        ItemType itemType,

        @NotNull(message = "Payment method is required")
        PaymentMethod paymentMethod
) {
}
