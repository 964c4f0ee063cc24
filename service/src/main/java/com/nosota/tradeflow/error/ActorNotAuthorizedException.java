package com.nosota.tradeflow.error;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when the actor is not a party of the entity in the role it claims.
 */
@Getter
public class ActorNotAuthorizedException extends WorkflowException {

    private final EntityType entityType;
    private final UUID entityId;
    private final Long actorId;
    private final ActorRole actorRole;

    public ActorNotAuthorizedException(EntityType entityType, UUID entityId, Long actorId,
                                       ActorRole actorRole, String operation) {
        super(String.format("Actor %s acting as %s may not %s %s %s",
                actorId, actorRole, operation, entityType, entityId));
        this.entityType = entityType;
        this.entityId = entityId;
        this.actorId = actorId;
        this.actorRole = actorRole;

        detail("entityType", entityType);
        detail("entityId", entityId);
        detail("actorId", actorId);
        detail("actorRole", actorRole);
        detail("operation", operation);
    }
}
