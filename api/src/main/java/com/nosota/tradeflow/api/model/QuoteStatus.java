package com.nosota.tradeflow.api.model;

/**
 * Custom quote status.
 *
 * <p>At most one quote per conversation is in {@link #PENDING} or {@link #SENT} at any time.
 */
public enum QuoteStatus {
    /**
     * REQUESTED: opened by the buyer, the seller has not priced it yet.
     */
    REQUESTED,

    /**
     * PENDING: drafted by the seller, already binding but not yet announced.
     */
    PENDING,

    /**
     * SENT: priced and delivered to the buyer.
     */
    SENT,

    /**
     * ACCEPTED: accepted by the buyer, can be turned into an order or booking.
     */
    ACCEPTED,

    /**
     * REJECTED: declined by the buyer or the seller.
     */
    REJECTED,

    /**
     * EXPIRED: expiresAt passed before the buyer accepted. Applied lazily on read and accept.
     */
    EXPIRED,

    /**
     * SUPERSEDED: replaced by a newer quote in the same conversation.
     */
    SUPERSEDED
}
