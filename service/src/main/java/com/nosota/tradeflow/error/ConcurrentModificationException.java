package com.nosota.tradeflow.error;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when the optimistic version check failed and the single automatic retry did not
 * resolve it. The caller should reload and retry.
 */
@Getter
public class ConcurrentModificationException extends WorkflowException {

    private final EntityType entityType;
    private final UUID entityId;
    private final WorkflowAction action;

    public ConcurrentModificationException(EntityType entityType, UUID entityId, WorkflowAction action,
                                           Throwable cause) {
        super(String.format("%s %s was modified concurrently while applying %s", entityType, entityId, action),
                cause);
        this.entityType = entityType;
        this.entityId = entityId;
        this.action = action;

        detail("entityType", entityType);
        detail("entityId", entityId);
        detail("action", action);
    }
}
