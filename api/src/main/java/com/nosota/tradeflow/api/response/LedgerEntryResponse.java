package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.LedgerEntryType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Commission ledger entry.
 *
 * @param commissionRate   Fraction, e.g. 0.20 for 20%
 * @param reversedEntryId  For REVERSAL entries, the PAYOUT entry being reversed
 */
public record LedgerEntryResponse(
        UUID id,
        EntityType entityType,
        UUID entityId,
        Long sellerId,
        LedgerEntryType entryType,
        BigDecimal amount,
        BigDecimal commissionRate,
        BigDecimal commissionAmount,
        BigDecimal sellerPayout,
        UUID reversedEntryId,
        LocalDateTime createdAt
) {
}
