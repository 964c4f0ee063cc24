package com.nosota.tradeflow.controller;

import com.nosota.tradeflow.api.model.ActorRole;

/**
 * SYSTEM is reserved for internal callers and may not be claimed through the actor headers.
 */
final class ExternalActor {

    private ExternalActor() {
    }

    static ActorRole require(ActorRole role) {
        if (role == ActorRole.SYSTEM) {
            throw new IllegalArgumentException("Role SYSTEM cannot be used by API callers");
        }
        return role;
    }
}
