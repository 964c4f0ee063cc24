package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.request.TransitionRequest;
import com.nosota.tradeflow.api.response.TransitionResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Workflow API: the single entry point for status changes of orders, bookings, quotes,
 * design approvals, return requests and boost purchases.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>WorkflowController - in service module (server-side implementation)</li>
 *   <li>WorkflowClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/workflow")
public interface WorkflowApi {

    /**
     * Applies an action to an entity.
     *
     * <p>The server validates that the actor is a party of the entity, that the action is
     * legal from the current status for the actor's role, applies the change and runs its
     * side effects (system message, notifications, ledger entries) in one transaction.
     *
     * @param entityType Entity type
     * @param entityId   Entity ID
     * @param actorId    Acting user
     * @param actorRole  Role the user acts in (BUYER, SELLER or ADMIN)
     * @param request    Action and optional payload
     * @return Transition result with the updated entity and performed side effects
     */
    @PostMapping("/{entityType}/{entityId}/transitions")
    ResponseEntity<TransitionResponse> applyTransition(
            @PathVariable("entityType") EntityType entityType,
            @PathVariable("entityId") UUID entityId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid TransitionRequest request);
}
