package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;

import java.util.UUID;

/**
 * Party checks for reads and creations outside the workflow engine.
 */
final class ActorAccess {

    private ActorAccess() {
    }

    static void requireParty(EntityType entityType, UUID entityId, Long buyerId, Long sellerId,
                             Long actorId, ActorRole actorRole, String operation) {
        boolean permitted = switch (actorRole) {
            case ADMIN, SYSTEM -> true;
            case BUYER -> actorId != null && actorId.equals(buyerId);
            case SELLER -> actorId != null && actorId.equals(sellerId);
        };
        if (!permitted) {
            throw new ActorNotAuthorizedException(entityType, entityId, actorId, actorRole, operation);
        }
    }

    static void requireRole(EntityType entityType, UUID entityId, Long actorId, ActorRole actorRole,
                            ActorRole required, String operation) {
        if (actorRole != required) {
            throw new ActorNotAuthorizedException(entityType, entityId, actorId, actorRole, operation);
        }
    }
}
