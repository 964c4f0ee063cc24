package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.LedgerEntryType;
import com.nosota.tradeflow.model.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {

    List<LedgerEntry> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(EntityType entityType, UUID entityId);

    Optional<LedgerEntry> findFirstByEntityTypeAndEntityIdAndEntryType(EntityType entityType, UUID entityId,
                                                                       LedgerEntryType entryType);

    boolean existsByEntryTypeAndSourceId(LedgerEntryType entryType, UUID sourceId);

    /**
     * Sum of the (negative) commission amounts of the reversals booked against a payout.
     */
    @Query("""
            SELECT COALESCE(SUM(e.commissionAmount), 0)
            FROM LedgerEntry e
            WHERE e.reversedEntryId = :payoutId
              AND e.entryType = 'REVERSAL'
            """)
    BigDecimal sumReversalCommission(@Param("payoutId") UUID payoutId);
}
