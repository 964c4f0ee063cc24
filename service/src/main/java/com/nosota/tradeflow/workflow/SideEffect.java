package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.SideEffectType;

import java.util.UUID;

/**
 * A cross-entity effect performed as part of a transition.
 *
 * @param type     What was done
 * @param targetId Entity the effect touched (message, ledger entry, boosted item, ...)
 * @param detail   Short human readable description
 */
public record SideEffect(SideEffectType type, UUID targetId, String detail) {
}
