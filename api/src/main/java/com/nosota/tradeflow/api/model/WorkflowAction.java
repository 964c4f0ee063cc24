package com.nosota.tradeflow.api.model;

/**
 * Actions a caller may request on a workflow entity.
 *
 * <p>Whether an action is legal depends on the entity's current status and the
 * caller's {@link ActorRole}; the transition tables on the server are the only
 * authority for that decision.
 */
public enum WorkflowAction {
    // payment
    SUBMIT_PAYMENT,
    MARK_PAID,
    REQUEST_PAYMENT,
    FAIL,

    // order fulfilment
    START_PROCESSING,
    MARK_READY_TO_SHIP,
    SHIP,
    DELIVER,

    // booking lifecycle
    CONFIRM,
    START,
    COMPLETE,

    // negotiation
    SEND,
    ACCEPT,
    REJECT,
    EXPIRE,
    SUPERSEDE,
    APPROVE,
    REQUEST_CHANGES,
    RESUBMIT,

    // returns
    REQUEST_RETURN,
    START_REVIEW,
    SELLER_APPROVE,
    SELLER_REJECT,
    ADMIN_APPROVE,
    ADMIN_REJECT,
    REFUND,
    CLOSE,

    // conversations
    RESOLVE,
    ARCHIVE,

    CANCEL
}
