package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.EntityType;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of {@link WorkflowEngine#applyTransition}.
 *
 * @param entityType     Entity type
 * @param entityId       Entity ID
 * @param previousStatus Status before the call
 * @param status         Status after the call, including system follow-up moves
 * @param version        Optimistic version after the call
 * @param noOp           True when the call changed nothing (repeated flag, lost race already applied)
 * @param entity         API view of the entity
 * @param sideEffects    Effects performed, in execution order
 */
public record TransitionResult(
        EntityType entityType,
        UUID entityId,
        String previousStatus,
        String status,
        Long version,
        boolean noOp,
        Object entity,
        List<SideEffect> sideEffects
) {
}
