package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.LedgerEntryType;
import com.nosota.tradeflow.model.LedgerEntry;
import com.nosota.tradeflow.repository.LedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Commission bookkeeping for completed orders and bookings.
 *
 * <p>Payout: {@code commission = amount × rate}, {@code sellerPayout = amount − commission}.
 * Reversal on refund: {@code commission = refund × rate of the payout}, capped at the
 * commission not yet reversed, and {@code sellerPayout = refund − commission}; both are
 * stored negated.
 *
 * <p>Runs inside the caller's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommissionLedgerService {

    private static final int SCALE = 2;

    private final LedgerEntryRepository ledgerEntryRepository;

    @Value("${workflow.commission.default-rate:0.20}")
    private BigDecimal commissionRate;

    /**
     * Records the payout of an order or booking. Recording twice returns the first entry.
     */
    public LedgerEntry recordPayout(EntityType entityType, UUID entityId, Long sellerId, BigDecimal amount) {
        Optional<LedgerEntry> existing = ledgerEntryRepository
                .findFirstByEntityTypeAndEntityIdAndEntryType(entityType, entityId, LedgerEntryType.PAYOUT);
        if (existing.isPresent()) {
            log.info("Payout for {} {} already recorded: {}", entityType, entityId, existing.get().getId());
            return existing.get();
        }

        BigDecimal commission = amount.multiply(commissionRate).setScale(SCALE, RoundingMode.HALF_UP);

        LedgerEntry entry = new LedgerEntry();
        entry.setEntityType(entityType);
        entry.setEntityId(entityId);
        entry.setSellerId(sellerId);
        entry.setEntryType(LedgerEntryType.PAYOUT);
        entry.setAmount(amount.setScale(SCALE, RoundingMode.HALF_UP));
        entry.setCommissionRate(commissionRate);
        entry.setCommissionAmount(commission);
        entry.setSellerPayout(entry.getAmount().subtract(commission));
        entry.setCreatedAt(LocalDateTime.now());

        LedgerEntry saved = ledgerEntryRepository.save(entry);
        log.info("Recorded payout for {} {}: amount={}, commission={}, sellerPayout={}",
                entityType, entityId, saved.getAmount(), saved.getCommissionAmount(), saved.getSellerPayout());
        return saved;
    }

    /**
     * Reverses the commission of a payout for a refund.
     *
     * @param entityType   ORDER or BOOKING
     * @param entityId     Order or booking ID
     * @param refundAmount Approved refund amount
     * @param sourceId     Return request the refund belongs to; a second reversal for the same
     *                     source is ignored
     * @return the reversal entry, or empty when there is no payout to reverse (refund before
     * completion) or nothing is left to reverse
     */
    public Optional<LedgerEntry> reverse(EntityType entityType, UUID entityId, BigDecimal refundAmount,
                                         UUID sourceId) {
        if (ledgerEntryRepository.existsByEntryTypeAndSourceId(LedgerEntryType.REVERSAL, sourceId)) {
            log.info("Commission for refund {} already reversed", sourceId);
            return Optional.empty();
        }

        Optional<LedgerEntry> payout = ledgerEntryRepository
                .findFirstByEntityTypeAndEntityIdAndEntryType(entityType, entityId, LedgerEntryType.PAYOUT);
        if (payout.isEmpty()) {
            log.info("No payout recorded for {} {}, nothing to reverse for refund {}", entityType, entityId, sourceId);
            return Optional.empty();
        }

        LedgerEntry original = payout.get();
        BigDecimal remaining = original.getCommissionAmount()
                .add(ledgerEntryRepository.sumReversalCommission(original.getId()));
        BigDecimal commission = refundAmount.multiply(original.getCommissionRate())
                .setScale(SCALE, RoundingMode.HALF_UP)
                .min(remaining);
        if (commission.signum() <= 0) {
            log.info("Commission of payout {} is fully reversed already", original.getId());
            return Optional.empty();
        }

        BigDecimal refund = refundAmount.setScale(SCALE, RoundingMode.HALF_UP);

        LedgerEntry reversal = new LedgerEntry();
        reversal.setEntityType(entityType);
        reversal.setEntityId(entityId);
        reversal.setSellerId(original.getSellerId());
        reversal.setEntryType(LedgerEntryType.REVERSAL);
        reversal.setAmount(refund.negate());
        reversal.setCommissionRate(original.getCommissionRate());
        reversal.setCommissionAmount(commission.negate());
        reversal.setSellerPayout(refund.subtract(commission).negate());
        reversal.setReversedEntryId(original.getId());
        reversal.setSourceId(sourceId);
        reversal.setCreatedAt(LocalDateTime.now());

        LedgerEntry saved = ledgerEntryRepository.save(reversal);
        log.info("Reversed commission {} of payout {} for refund {} ({} {})",
                commission, original.getId(), sourceId, entityType, entityId);
        return Optional.of(saved);
    }

    public List<LedgerEntry> listEntries(EntityType entityType, UUID entityId) {
        return ledgerEntryRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId);
    }
}
