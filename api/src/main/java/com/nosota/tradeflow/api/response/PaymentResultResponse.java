package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.EntityType;

import java.util.UUID;

/**
 * Acknowledgement of a payment callback.
 *
 * @param noOp True when the reference had already been settled by an earlier callback
 */
public record PaymentResultResponse(
        UUID referenceId,
        EntityType entityType,
        UUID entityId,
        String entityStatus,
        boolean noOp
) {
}
