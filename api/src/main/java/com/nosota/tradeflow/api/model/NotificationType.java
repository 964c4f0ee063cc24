package com.nosota.tradeflow.api.model;

public enum NotificationType {
    MESSAGE_RECEIVED,
    CONVERSATION_RESOLUTION_REQUESTED,
    CONVERSATION_STATUS_CHANGED,

    ORDER_CREATED,
    ORDER_PAYMENT_SUBMITTED,
    ORDER_PAID,
    ORDER_PROCESSING,
    ORDER_READY_TO_SHIP,
    ORDER_SHIPPED,
    ORDER_DELIVERED,
    ORDER_CANCELLED,

    BOOKING_REQUESTED,
    BOOKING_CONFIRMED,
    BOOKING_PAYMENT_SUBMITTED,
    BOOKING_PAID,
    BOOKING_STARTED,
    BOOKING_COMPLETED,
    BOOKING_CANCELLED,

    QUOTE_REQUESTED,
    QUOTE_RECEIVED,
    QUOTE_ACCEPTED,
    QUOTE_REJECTED,
    QUOTE_EXPIRED,
    QUOTE_SUPERSEDED,

    DESIGN_SUBMITTED,
    DESIGN_RESUBMITTED,
    DESIGN_APPROVED,
    DESIGN_REJECTED,
    DESIGN_CHANGES_REQUESTED,

    RETURN_REQUESTED,
    RETURN_UNDER_REVIEW,
    RETURN_SELLER_RESPONDED,
    RETURN_APPROVED,
    RETURN_REJECTED,
    RETURN_CANCELLED,
    RETURN_COMPLETED,
    REFUND_PROCESSED,

    PAYMENT_FAILED,

    BOOST_ACTIVATED,
    BOOST_PAYMENT_FAILED,
    BOOST_CANCELLED
}
