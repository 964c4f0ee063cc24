package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.ItemType;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Admin request to boost an item without a purchase.
 */
public record CreateBoostedItemRequest(
        @NotNull(message = "Item ID is required")
        UUID itemId,

        @NotNull(message = "Item type is required")
        ItemType itemType,

        @NotNull(message = "Package ID is required")
        UUID packageId,

        @NotNull(message = "Seller ID is required")
        Long sellerId
) {
}
