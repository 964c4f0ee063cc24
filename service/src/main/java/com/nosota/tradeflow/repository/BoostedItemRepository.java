package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.model.BoostedItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface BoostedItemRepository extends JpaRepository<BoostedItem, UUID> {

    /**
     * Locks the active rows of one item. Activation runs under this lock so that two
     * confirmations for the same item cannot both insert a row.
     *
     * @param itemId   Item ID
     * @param itemType Item type
     * @return Active rows, at most one when the invariant holds
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT b
            FROM BoostedItem b
            WHERE b.itemId = :itemId
              AND b.itemType = :itemType
              AND b.active = true
            ORDER BY b.endDate DESC
            """)
    List<BoostedItem> findActiveForUpdate(@Param("itemId") UUID itemId, @Param("itemType") ItemType itemType);

    @Query("""
            SELECT b
            FROM BoostedItem b
            WHERE b.active = true
              AND b.endDate > :now
              AND (:itemType IS NULL OR b.itemType = :itemType)
            ORDER BY b.endDate ASC
            """)
    List<BoostedItem> findLive(@Param("itemType") ItemType itemType, @Param("now") LocalDateTime now);

    /**
     * Deactivates every active row whose window ended before {@code now}.
     *
     * @return Number of rows deactivated
     */
    @Modifying
    @Query("""
            UPDATE BoostedItem b
            SET b.active = false
            WHERE b.active = true
              AND b.endDate <= :now
            """)
    int deactivateExpired(@Param("now") LocalDateTime now);
}
