package com.nosota.tradeflow.api.request;

import com.nosota.tradeflow.api.model.WorkflowAction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for applying a workflow action to an entity.
 *
 * @param action  Requested action
 * @param payload Action specific data, may be null
 */
public record TransitionRequest(
        @NotNull(message = "Action is required")
        WorkflowAction action,

        @Valid
        TransitionPayload payload
) {
}
