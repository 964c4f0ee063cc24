package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.TransitionPayload;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * State of one move while the engine applies it.
 *
 * <p>Handlers read the request from here, mark the move as a no-op when it changes nothing,
 * record effects they performed inline and queue effects that must run after the entity row
 * is written.
 */
@Getter
public class TransitionContext {

    private final EntityType entityType;
    private final UUID entityId;
    private final WorkflowAction action;
    private final Long actorId;
    private final ActorRole actorRole;
    private final TransitionPayload payload;
    private final Enum<?> from;
    private final Enum<?> to;

    private boolean noOp;
    private final List<SideEffectTask> queued = new ArrayList<>();
    private final List<SideEffect> performed = new ArrayList<>();

    public TransitionContext(EntityType entityType, UUID entityId, WorkflowAction action, Long actorId,
                             ActorRole actorRole, TransitionPayload payload, Enum<?> from, Enum<?> to) {
        this.entityType = entityType;
        this.entityId = entityId;
        this.action = action;
        this.actorId = actorId;
        this.actorRole = actorRole;
        this.payload = payload == null ? TransitionPayload.empty() : payload;
        this.from = from;
        this.to = to;
    }

    public String notes() {
        return payload.notes();
    }

    public void markNoOp() {
        this.noOp = true;
    }

    public void enqueue(SideEffectTask task) {
        queued.add(task);
    }

    public void record(SideEffect effect) {
        performed.add(effect);
    }

    public boolean isSystem() {
        return actorRole == ActorRole.SYSTEM;
    }

    public List<SideEffectTask> getQueued() {
        return Collections.unmodifiableList(queued);
    }

    public List<SideEffect> getPerformed() {
        return Collections.unmodifiableList(performed);
    }
}
