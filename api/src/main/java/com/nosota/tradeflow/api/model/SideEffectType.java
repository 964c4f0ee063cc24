package com.nosota.tradeflow.api.model;

/**
 * Side effects the workflow engine performed inside a transition's transaction.
 * Returned to callers so they can decide what else to refresh or broadcast.
 */
public enum SideEffectType {
    SYSTEM_MESSAGE_POSTED,
    NOTIFICATION_QUEUED,
    AUTO_TRANSITION,
    PAYMENT_SESSION_REQUESTED,
    COMMISSION_RECORDED,
    COMMISSION_REVERSED,
    QUOTE_SUPERSEDED,
    BOOSTED_ITEM_ACTIVATED,
    BOOKING_CANCELLED
}
