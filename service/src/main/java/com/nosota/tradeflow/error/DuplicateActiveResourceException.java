package com.nosota.tradeflow.error;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when creating a resource would leave two active resources where only one may be
 * active (boosted item per item, open return attempt per order, pending design per item).
 */
@Getter
public class DuplicateActiveResourceException extends WorkflowException {

    private final String resource;
    private final Object scope;
    private final UUID existingId;

    public DuplicateActiveResourceException(String resource, Object scope, UUID existingId) {
        super(String.format("An active %s already exists for %s: %s", resource, scope, existingId));
        this.resource = resource;
        this.scope = scope;
        this.existingId = existingId;

        detail("resource", resource);
        detail("scope", scope);
        detail("existingId", existingId);
    }
}
