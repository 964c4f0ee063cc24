package com.nosota.tradeflow.repository;

import jakarta.persistence.EntityManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Transaction-scoped PostgreSQL advisory locks.
 *
 * <p>Used where a check-then-insert has no existing row to lock: the first boost of an item,
 * the first pre-purchase conversation of a buyer about an item. The lock is released when the
 * surrounding transaction ends, so callers must already be transactional.
 */
@Repository
public class AdvisoryLockRepository {
    @Autowired
    private EntityManager entityManager;

    /**
     * Blocks until the lock for {@code key} is held by the current transaction.
     *
     * @param key Lock name, hashed to the 32-bit advisory lock key
     */
    public void lock(String key) {
        entityManager.createNativeQuery("SELECT 1 FROM pg_advisory_xact_lock(hashtext(:key))")
                .setParameter("key", key)
                .getSingleResult();
    }

    public static String boostedItemKey(Object itemType, Object itemId) {
        return "boosted-item:" + itemType + ":" + itemId;
    }

    public static String prePurchaseKey(Long buyerId, Long sellerId, Object contextId) {
        return "pre-purchase:" + buyerId + ":" + sellerId + ":" + contextId;
    }
}
