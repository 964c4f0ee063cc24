package com.nosota.tradeflow.api.model;

/**
 * Status of a buyer-submitted design awaiting seller sign-off.
 */
public enum DesignApprovalStatus {
    /** Submitted, waiting for the seller. */
    PENDING,
    /** Seller asked for changes; the buyer may resubmit or send a new design. */
    CHANGES_REQUESTED,
    /** Buyer uploaded new files after a change request. */
    RESUBMITTED,
    APPROVED,
    REJECTED,
    /** Replaced by a newer submission for the same item. */
    SUPERSEDED
}
