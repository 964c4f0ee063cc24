package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.ConcurrentModificationException;
import com.nosota.tradeflow.statemachine.TransitionTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies state transitions to workflow entities.
 *
 * <p>Every status change of an order, booking, quote, design approval, return request or boost
 * purchase goes through {@link #applyTransition}. A call:
 * <ol>
 *   <li>applies any overdue system move first (expired quote), in its own unit of work</li>
 *   <li>checks that the actor is a party of the entity in the role it claims</li>
 *   <li>resolves the move in the entity's {@link TransitionTable}</li>
 *   <li>lets the handler apply guards and field updates, writes the row with a version check</li>
 *   <li>applies system follow-up moves (booking confirmed → pending_payment)</li>
 *   <li>runs the queued side effects (system message, notifications, ledger) in the same
 *       transaction</li>
 * </ol>
 *
 * <p>A failed version check is retried once with a fresh read. If the retry finds the entity
 * already in the state the first attempt was heading to, the call is a no-op; a second failure
 * surfaces as {@link ConcurrentModificationException}. No retry is attempted when the caller
 * already holds a transaction, since that transaction is rollback-only by then.
 */
@Service
@Slf4j
public class WorkflowEngine {

    private final Map<EntityType, WorkflowHandler<?, ?>> handlers = new EnumMap<>(EntityType.class);
    private final TransactionTemplate transactionTemplate;

    public WorkflowEngine(List<WorkflowHandler<?, ?>> handlers, TransactionTemplate transactionTemplate) {
        for (WorkflowHandler<?, ?> handler : handlers) {
            WorkflowHandler<?, ?> previous = this.handlers.put(handler.entityType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two workflow handlers for " + handler.entityType());
            }
        }
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Applies {@code action} to an entity.
     *
     * @param entityType Entity type
     * @param entityId   Entity ID
     * @param action     Requested action
     * @param actorId    Acting user, null for SYSTEM
     * @param actorRole  Role the actor acts in
     * @param payload    Action data (notes, amounts, tracking, ...), may be null
     * @return the entity after the move and the side effects performed
     * @throws com.nosota.tradeflow.error.InvalidTransitionException   if the move is not legal
     * @throws ActorNotAuthorizedException                             if the actor is not a party
     * @throws com.nosota.tradeflow.error.EntityNotFoundException      if the entity does not exist
     * @throws ConcurrentModificationException                         if the version check failed twice
     */
    public TransitionResult applyTransition(EntityType entityType, UUID entityId, WorkflowAction action,
                                            Long actorId, ActorRole actorRole, TransitionPayload payload) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(actorRole, "actorRole");
        return apply(handlerFor(entityType), entityId, action, actorId, actorRole, payload);
    }

    /**
     * Applies the entity's overdue system move, if any.
     *
     * @return true if a move was applied
     */
    public boolean expireIfDue(EntityType entityType, UUID entityId) {
        return expireIfDue(handlerFor(entityType), entityId);
    }

    public EntitySnapshot snapshot(EntityType entityType, UUID entityId) {
        return snapshot(handlerFor(entityType), entityId);
    }

    private <E, S extends Enum<S>> EntitySnapshot snapshot(WorkflowHandler<E, S> handler, UUID entityId) {
        E entity = handler.load(entityId);
        return new EntitySnapshot(handler.statusOf(entity).name(), handler.buyerOf(entity),
                handler.sellerOf(entity), handler.conversationOf(entity));
    }

    private <E, S extends Enum<S>> TransitionResult apply(WorkflowHandler<E, S> handler, UUID entityId,
                                                           WorkflowAction action, Long actorId,
                                                           ActorRole actorRole, TransitionPayload payload) {
        expireIfDue(handler, entityId);

        AtomicReference<S> heading = new AtomicReference<>();
        try {
            return transactionTemplate.execute(status ->
                    doApply(handler, entityId, action, actorId, actorRole, payload, heading, null));
        } catch (OptimisticLockingFailureException e) {
            if (TransactionSynchronizationManager.isActualTransactionActive()) {
                throw new ConcurrentModificationException(handler.entityType(), entityId, action, e);
            }
            log.warn("Version conflict on {} {} applying {}, retrying once with fresh state",
                    handler.entityType(), entityId, action);
        }

        S expected = heading.get();
        try {
            return transactionTemplate.execute(status ->
                    doApply(handler, entityId, action, actorId, actorRole, payload, new AtomicReference<>(), expected));
        } catch (OptimisticLockingFailureException e) {
            log.warn("Version conflict on {} {} applying {} persisted after retry",
                    handler.entityType(), entityId, action);
            throw new ConcurrentModificationException(handler.entityType(), entityId, action, e);
        }
    }

    private <E, S extends Enum<S>> TransitionResult doApply(WorkflowHandler<E, S> handler, UUID entityId,
                                                             WorkflowAction action, Long actorId,
                                                             ActorRole actorRole, TransitionPayload payload,
                                                             AtomicReference<S> heading, S alreadyReached) {
        E entity = handler.load(entityId);
        S from = handler.statusOf(entity);

        authorize(handler, entity, entityId, actorId, actorRole, action);

        TransitionTable<S> table = handler.table();
        if (alreadyReached != null && from == alreadyReached
                && table.find(from, action).map(t -> !t.isSelfLoop()).orElse(true)) {
            log.info("{} {} already {} after concurrent {}, nothing to do",
                    handler.entityType(), entityId, from, action);
            return new TransitionResult(handler.entityType(), entityId, from.name(), from.name(),
                    handler.versionOf(entity), true, handler.toResponse(entity), List.of());
        }

        TransitionTable.Transition<S> transition = table.resolve(entityId, from, action, actorRole);
        heading.set(transition.to());

        TransitionContext ctx = new TransitionContext(handler.entityType(), entityId, action, actorId,
                actorRole, payload, from, transition.to());
        handler.onTransition(entity, ctx);

        if (ctx.isNoOp()) {
            log.info("{} {} {} by {} {} changed nothing", handler.entityType(), entityId, action, actorRole, actorId);
            return new TransitionResult(handler.entityType(), entityId, from.name(), from.name(),
                    handler.versionOf(entity), true, handler.toResponse(entity), List.of());
        }

        handler.setStatus(entity, transition.to());
        entity = handler.save(entity);
        log.info("{} {}: {} -> {} ({} by {} {})", handler.entityType(), entityId, from, transition.to(),
                action, actorRole, actorId);

        List<TransitionContext> applied = new ArrayList<>();
        applied.add(ctx);

        S reached = transition.to();
        Optional<WorkflowAction> next = handler.followUp(entity, reached);
        while (next.isPresent()) {
            WorkflowAction followUp = next.get();
            TransitionTable.Transition<S> step = table.resolve(entityId, reached, followUp, ActorRole.SYSTEM);
            TransitionContext stepCtx = new TransitionContext(handler.entityType(), entityId, followUp, null,
                    ActorRole.SYSTEM, TransitionPayload.empty(), reached, step.to());
            handler.onTransition(entity, stepCtx);
            stepCtx.record(new SideEffect(SideEffectType.AUTO_TRANSITION, entityId,
                    reached.name() + " -> " + step.to().name()));
            handler.setStatus(entity, step.to());
            entity = handler.save(entity);
            log.info("{} {}: {} -> {} (system follow-up {})", handler.entityType(), entityId, reached,
                    step.to(), followUp);
            applied.add(stepCtx);
            reached = step.to();
            next = handler.followUp(entity, reached);
        }

        List<SideEffect> sideEffects = new ArrayList<>();
        for (TransitionContext done : applied) {
            sideEffects.addAll(done.getPerformed());
            for (SideEffectTask task : done.getQueued()) {
                SideEffect effect = task.run();
                if (effect != null) {
                    sideEffects.add(effect);
                }
            }
        }

        return new TransitionResult(handler.entityType(), entityId, from.name(), reached.name(),
                handler.versionOf(entity), false, handler.toResponse(entity), sideEffects);
    }

    private <E, S extends Enum<S>> boolean expireIfDue(WorkflowHandler<E, S> handler, UUID entityId) {
        try {
            Boolean applied = transactionTemplate.execute(status -> {
                E entity = handler.load(entityId);
                Optional<WorkflowAction> due = handler.dueSystemAction(entity);
                if (due.isEmpty()) {
                    return false;
                }
                doApply(handler, entityId, due.get(), null, ActorRole.SYSTEM, TransitionPayload.empty(),
                        new AtomicReference<>(), null);
                return true;
            });
            return Boolean.TRUE.equals(applied);
        } catch (OptimisticLockingFailureException e) {
            if (TransactionSynchronizationManager.isActualTransactionActive()) {
                throw new ConcurrentModificationException(handler.entityType(), entityId, null, e);
            }
            // Another request moved the entity first; the caller re-reads it.
            log.info("{} {} changed while applying its overdue system move", handler.entityType(), entityId);
            return false;
        }
    }

    private <E, S extends Enum<S>> void authorize(WorkflowHandler<E, S> handler, E entity, UUID entityId,
                                                  Long actorId, ActorRole actorRole, WorkflowAction action) {
        boolean permitted = switch (actorRole) {
            case ADMIN, SYSTEM -> true;
            case BUYER -> actorId != null && actorId.equals(handler.buyerOf(entity));
            case SELLER -> actorId != null && actorId.equals(handler.sellerOf(entity));
        };
        if (!permitted) {
            log.warn("{} {} refused {} for {} {}: not a party", handler.entityType(), entityId, action,
                    actorRole, actorId);
            throw new ActorNotAuthorizedException(handler.entityType(), entityId, actorId, actorRole,
                    action.name().toLowerCase());
        }
    }

    private WorkflowHandler<?, ?> handlerFor(EntityType entityType) {
        WorkflowHandler<?, ?> handler = handlers.get(entityType);
        if (handler == null) {
            throw new IllegalArgumentException("No workflow for entity type " + entityType);
        }
        return handler;
    }
}
