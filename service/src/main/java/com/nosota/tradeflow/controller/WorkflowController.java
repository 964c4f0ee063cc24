package com.nosota.tradeflow.controller;

import com.nosota.tradeflow.api.WorkflowApi;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.request.TransitionRequest;
import com.nosota.tradeflow.api.response.SideEffectResponse;
import com.nosota.tradeflow.api.response.TransitionResponse;
import com.nosota.tradeflow.workflow.TransitionResult;
import com.nosota.tradeflow.workflow.WorkflowEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class WorkflowController implements WorkflowApi {

    private final WorkflowEngine workflowEngine;

    @Override
    public ResponseEntity<TransitionResponse> applyTransition(EntityType entityType, UUID entityId, Long actorId,
                                                              ActorRole actorRole, TransitionRequest request) {
        if (entityType == EntityType.CONVERSATION) {
            throw new IllegalArgumentException("Conversation status is changed through /api/v1/conversations/{id}/status");
        }
        TransitionResult result = workflowEngine.applyTransition(entityType, entityId, request.action(),
                actorId, ExternalActor.require(actorRole), request.payload());

        TransitionResponse response = new TransitionResponse(
                result.entityType(),
                result.entityId(),
                result.previousStatus(),
                result.status(),
                result.version(),
                result.noOp(),
                result.entity(),
                result.sideEffects().stream()
                        .map(effect -> new SideEffectResponse(effect.type(), effect.targetId(), effect.detail()))
                        .toList());
        return ResponseEntity.ok(response);
    }
}
