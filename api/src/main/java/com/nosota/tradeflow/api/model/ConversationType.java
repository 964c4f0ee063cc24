package com.nosota.tradeflow.api.model;

/**
 * Commerce context a conversation is scoped to.
 */
public enum ConversationType {
    /**
     * PRE_PURCHASE_PRODUCT: buyer asks about a product. Requires productId only.
     */
    PRE_PURCHASE_PRODUCT,

    /**
     * PRE_PURCHASE_SERVICE: buyer asks about a service. Requires serviceId only.
     */
    PRE_PURCHASE_SERVICE,

    /**
     * GENERAL_INQUIRY: free-form question, no linked item.
     */
    GENERAL_INQUIRY,

    /**
     * COMPLAINT: dispute thread, usually with an admin.
     */
    COMPLAINT,

    /**
     * ORDER: thread attached to an order. Requires orderId.
     */
    ORDER,

    /**
     * BOOKING: thread attached to a booking. Requires bookingId.
     */
    BOOKING;

    public boolean isPrePurchase() {
        return this == PRE_PURCHASE_PRODUCT || this == PRE_PURCHASE_SERVICE;
    }
}
