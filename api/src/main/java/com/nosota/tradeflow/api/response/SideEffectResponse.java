package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.SideEffectType;

import java.util.UUID;

/**
 * Side effect performed by a transition.
 *
 * @param type     What happened
 * @param targetId Entity, conversation or ledger entry touched
 * @param detail   Human readable detail
 */
public record SideEffectResponse(
        SideEffectType type,
        UUID targetId,
        String detail
) {
}
