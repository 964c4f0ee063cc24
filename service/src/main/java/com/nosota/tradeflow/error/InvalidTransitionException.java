package com.nosota.tradeflow.error;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when an action is not permitted from the entity's current state for the actor's
 * role, or when a guard attached to an otherwise legal move fails.
 */
@Getter
public class InvalidTransitionException extends WorkflowException {

    private final EntityType entityType;
    private final UUID entityId;
    private final String currentState;
    private final WorkflowAction action;
    private final String requestedState;
    private final ActorRole actorRole;

    public InvalidTransitionException(EntityType entityType, UUID entityId, Enum<?> currentState,
                                      WorkflowAction action, Enum<?> requestedState, ActorRole actorRole) {
        this(entityType, entityId, currentState, action, requestedState, actorRole, null);
    }

    public InvalidTransitionException(EntityType entityType, UUID entityId, Enum<?> currentState,
                                      WorkflowAction action, Enum<?> requestedState, ActorRole actorRole,
                                      String reason) {
        super(buildMessage(entityType, entityId, currentState, action, requestedState, actorRole, reason));
        this.entityType = entityType;
        this.entityId = entityId;
        this.currentState = currentState == null ? null : currentState.name();
        this.action = action;
        this.requestedState = requestedState == null ? null : requestedState.name();
        this.actorRole = actorRole;

        detail("entityType", entityType);
        detail("entityId", entityId);
        detail("currentState", this.currentState);
        detail("action", action);
        detail("requestedState", this.requestedState);
        detail("actorRole", actorRole);
        detail("reason", reason);
    }

    private static String buildMessage(EntityType entityType, UUID entityId, Enum<?> currentState,
                                       WorkflowAction action, Enum<?> requestedState, ActorRole actorRole,
                                       String reason) {
        String message = String.format("Invalid %s transition for %s: %s -> %s (action %s, role %s)",
                entityType, entityId, currentState,
                requestedState == null ? "?" : requestedState, action, actorRole);
        return reason == null ? message : message + ": " + reason;
    }
}
