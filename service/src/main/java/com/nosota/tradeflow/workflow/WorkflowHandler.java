package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.statemachine.TransitionTable;

import java.util.Optional;
import java.util.UUID;

/**
 * Per-entity plug-in of the {@link WorkflowEngine}.
 *
 * <p>The engine owns the generic part of a move (authorization, table lookup, version check,
 * retry, side-effect execution); a handler owns what is specific to its entity: loading and
 * saving it, who its parties are, the guards and field updates of each action and the effects
 * each action queues.
 *
 * @param <E> entity class
 * @param <S> status enum
 */
public interface WorkflowHandler<E, S extends Enum<S>> {

    EntityType entityType();

    TransitionTable<S> table();

    E load(UUID id);

    S statusOf(E entity);

    void setStatus(E entity, S status);

    /**
     * Buyer party, or null when the entity has none (boost purchases).
     */
    Long buyerOf(E entity);

    Long sellerOf(E entity);

    UUID conversationOf(E entity);

    /**
     * Applies the action-specific guards and field updates. Called after the table accepted
     * the move and before the status is written.
     */
    void onTransition(E entity, TransitionContext ctx);

    /**
     * Writes the entity and flushes, so that a stale version fails here and not at commit.
     */
    E save(E entity);

    Long versionOf(E entity);

    Object toResponse(E entity);

    /**
     * System move the engine must apply right after the entity reached {@code reached}
     * (booking confirmed → pending_payment).
     */
    default Optional<WorkflowAction> followUp(E entity, S reached) {
        return Optional.empty();
    }

    /**
     * System move that is overdue on this entity and must be applied before any other action
     * is considered (lazy expiry).
     */
    default Optional<WorkflowAction> dueSystemAction(E entity) {
        return Optional.empty();
    }
}
