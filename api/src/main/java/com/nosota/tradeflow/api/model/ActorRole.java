package com.nosota.tradeflow.api.model;

/**
 * Role an actor plays in a single workflow call.
 *
 * <p>The same user may act as buyer in one call and seller in another, so the role is
 * always passed explicitly and never inferred from session state.
 */
public enum ActorRole {
    /**
     * BUYER: the purchasing party of an order, booking, quote or return.
     */
    BUYER,

    /**
     * SELLER: the party that owns the product or service being negotiated.
     */
    SELLER,

    /**
     * ADMIN: marketplace operator. Arbitrates returns, confirms payments and ships
     * consolidated orders.
     */
    ADMIN,

    /**
     * SYSTEM: internal actor used by payment callbacks, schedulers and automatic
     * follow-up moves. Never accepted from an external caller.
     */
    SYSTEM
}
