package com.nosota.tradeflow.api.model;

/**
 * Return request (return attempt) status.
 *
 * <pre>
 * REQUESTED -> UNDER_REVIEW -> SELLER_APPROVED / SELLER_REJECTED
 *           -> ADMIN_APPROVED -> REFUNDED | COMPLETED
 *           -> ADMIN_REJECTED
 * </pre>
 */
public enum ReturnRequestStatus {
    /**
     * REQUESTED: filed by the buyer.
     */
    REQUESTED,

    /**
     * UNDER_REVIEW: an admin picked the case up.
     */
    UNDER_REVIEW,

    /**
     * SELLER_APPROVED: the seller agreed, possibly with a proposed refund amount.
     */
    SELLER_APPROVED,

    /**
     * SELLER_REJECTED: the seller disputes the claim. Admin arbitration follows.
     */
    SELLER_REJECTED,

    /**
     * ADMIN_APPROVED: admin approved the claim with an approved refund amount.
     */
    ADMIN_APPROVED,

    /**
     * ADMIN_REJECTED: admin rejected the claim. Final state; the buyer may file
     * another attempt while attempts remain.
     */
    ADMIN_REJECTED,

    /**
     * REFUNDED: refund processed and commission reversed. Final state.
     */
    REFUNDED,

    /**
     * COMPLETED: closed without a monetary refund (replacement or repair). Final state.
     */
    COMPLETED,

    /**
     * CANCELLED: withdrawn by the buyer before resolution. Final state.
     */
    CANCELLED
}
