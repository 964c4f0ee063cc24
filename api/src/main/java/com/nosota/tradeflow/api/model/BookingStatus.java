package com.nosota.tradeflow.api.model;

/**
 * Service booking lifecycle status.
 */
public enum BookingStatus {
    /**
     * PENDING_CONFIRMATION: requested by the buyer, waiting for the seller.
     */
    PENDING_CONFIRMATION,

    /**
     * CONFIRMED: accepted by the seller. Transient, the booking moves on to
     * PENDING_PAYMENT in the same transaction.
     */
    CONFIRMED,

    /**
     * PENDING_PAYMENT: payment link issued. Only an admin or the payment callback
     * may move it to PAID.
     */
    PENDING_PAYMENT,

    /**
     * PAID: payment confirmed.
     */
    PAID,

    /**
     * ONGOING: service delivery has started.
     */
    ONGOING,

    /**
     * COMPLETED: service delivered. Final state; the seller payout is recorded on entry.
     */
    COMPLETED,

    /**
     * CANCELLED: final state.
     */
    CANCELLED
}
