package com.nosota.tradeflow.api.model;

/**
 * Boost purchase payment status.
 */
public enum BoostPurchaseStatus {
    /**
     * PENDING: created, no payment yet.
     */
    PENDING,

    /**
     * PROCESSING: bank slip submitted or gateway payment in flight.
     */
    PROCESSING,

    /**
     * PAID: confirmed. The boosted item has been activated or extended.
     */
    PAID,

    /**
     * FAILED: payment declined.
     */
    FAILED,

    /**
     * CANCELLED: withdrawn by the seller or an admin.
     */
    CANCELLED
}
