package com.nosota.tradeflow.error;

import com.nosota.tradeflow.api.model.EntityType;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a buyer files more return attempts for one order or booking than allowed.
 */
@Getter
public class AttemptLimitExceededException extends WorkflowException {

    private final EntityType parentType;
    private final UUID parentId;
    private final int attempts;
    private final int maxAttempts;

    public AttemptLimitExceededException(EntityType parentType, UUID parentId, int attempts, int maxAttempts) {
        super(String.format("%s %s already has %d return attempts, the maximum is %d",
                parentType, parentId, attempts, maxAttempts));
        this.parentType = parentType;
        this.parentId = parentId;
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;

        detail("entityType", parentType);
        detail("entityId", parentId);
        detail("attempts", attempts);
        detail("maxAttempts", maxAttempts);
    }
}
