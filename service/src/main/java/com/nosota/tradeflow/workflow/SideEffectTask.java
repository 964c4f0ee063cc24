package com.nosota.tradeflow.workflow;

/**
 * Deferred cross-entity effect, executed by the engine after the entity row is written and
 * before the transaction commits.
 */
@FunctionalInterface
public interface SideEffectTask {

    /**
     * @return the effect performed, or null if the task decided there was nothing to do
     */
    SideEffect run();
}
