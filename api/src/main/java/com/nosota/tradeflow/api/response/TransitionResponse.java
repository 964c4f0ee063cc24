package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.EntityType;

import java.util.List;
import java.util.UUID;

/**
 * Result of a workflow transition.
 *
 * @param entityType     Type of the transitioned entity
 * @param entityId       Entity ID
 * @param previousStatus Status before the call
 * @param status         Status after the call (after any automatic follow-up move)
 * @param version        Entity version after the call
 * @param noOp           True when the entity already was in the requested state
 * @param entity         Updated entity in its response shape (OrderResponse, QuoteResponse, ...)
 * @param sideEffects    Side effects performed in the same transaction
 */
public record TransitionResponse(
        EntityType entityType,
        UUID entityId,
        String previousStatus,
        String status,
        Long version,
        boolean noOp,
        Object entity,
        List<SideEffectResponse> sideEffects
) {
}
