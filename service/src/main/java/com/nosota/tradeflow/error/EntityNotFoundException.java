package com.nosota.tradeflow.error;

import com.nosota.tradeflow.api.model.EntityType;
import lombok.Getter;

@Getter
public class EntityNotFoundException extends WorkflowException {

    private final String entityName;
    private final Object entityId;

    public EntityNotFoundException(EntityType entityType, Object entityId) {
        this(entityType.name(), entityId);
    }

    public EntityNotFoundException(String entityName, Object entityId) {
        super(String.format("%s %s not found", entityName, entityId));
        this.entityName = entityName;
        this.entityId = entityId;

        detail("entityType", entityName);
        detail("entityId", entityId);
    }
}
