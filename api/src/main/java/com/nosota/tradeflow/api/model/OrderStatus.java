package com.nosota.tradeflow.api.model;

/**
 * Order lifecycle status.
 */
public enum OrderStatus {
    /**
     * PENDING_PAYMENT: order placed, waiting for the gateway callback or an admin
     * confirming a bank transfer.
     */
    PENDING_PAYMENT,

    /**
     * PAID: payment confirmed. Seller can start processing.
     */
    PAID,

    /**
     * PROCESSING: seller is preparing the item. The readyToShip flag is only
     * settable here.
     */
    PROCESSING,

    /**
     * SHIPPED: handed to the carrier by admin consolidation. Sellers never set this
     * directly.
     */
    SHIPPED,

    /**
     * DELIVERED: received by the buyer. Final state; the seller payout is recorded
     * on entry.
     */
    DELIVERED,

    /**
     * CANCELLED: cancelled before delivery. Final state.
     */
    CANCELLED
}
