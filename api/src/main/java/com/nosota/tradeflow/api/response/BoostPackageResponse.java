package com.nosota.tradeflow.api.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record BoostPackageResponse(
        UUID id,
        String name,
        String description,
        Integer durationDays,
        BigDecimal price,
        boolean active,
        LocalDateTime createdAt
) {
}
