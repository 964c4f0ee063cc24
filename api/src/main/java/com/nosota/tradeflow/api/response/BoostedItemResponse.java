package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.ItemType;

import java.time.LocalDateTime;
import java.util.UUID;

public record BoostedItemResponse(
        UUID id,
        UUID itemId,
        ItemType itemType,
        UUID packageId,
        Long sellerId,
        LocalDateTime startDate,
        LocalDateTime endDate,
        boolean active
) {
}
