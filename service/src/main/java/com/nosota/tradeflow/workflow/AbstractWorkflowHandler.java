package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.error.InvalidTransitionException;

import java.util.Objects;

/**
 * Helpers shared by the handlers: announcing a move in the conversation and to the parties,
 * and rejecting a move whose guard failed.
 */
public abstract class AbstractWorkflowHandler<E, S extends Enum<S>> implements WorkflowHandler<E, S> {

    protected final SideEffectFactory sideEffects;

    protected AbstractWorkflowHandler(SideEffectFactory sideEffects) {
        this.sideEffects = sideEffects;
    }

    protected abstract String linkOf(E entity);

    /**
     * Queues a system message in the entity's conversation (if it has one) and a notification
     * to each party except the actor.
     */
    protected void announce(E entity, TransitionContext ctx, String systemMessage, NotificationType type,
                            String title, String message) {
        if (systemMessage != null) {
            ctx.enqueue(sideEffects.systemMessage(conversationOf(entity), systemMessage));
        }
        notifyParty(entity, ctx, buyerOf(entity), type, title, message);
        notifyParty(entity, ctx, sellerOf(entity), type, title, message);
    }

    protected void notifyParty(E entity, TransitionContext ctx, Long userId, NotificationType type,
                               String title, String message) {
        if (userId == null || Objects.equals(userId, ctx.getActorId())) {
            return;
        }
        ctx.enqueue(sideEffects.notification(userId, type, title, message, linkOf(entity), ctx.getEntityId()));
    }

    protected InvalidTransitionException guardFailed(E entity, TransitionContext ctx, String reason) {
        return new InvalidTransitionException(entityType(), ctx.getEntityId(), statusOf(entity),
                ctx.getAction(), ctx.getTo(), ctx.getActorRole(), reason);
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
