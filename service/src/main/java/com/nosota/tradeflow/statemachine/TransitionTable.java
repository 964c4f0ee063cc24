package com.nosota.tradeflow.statemachine;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.error.InvalidTransitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Directed graph of the legal moves of one entity type.
 *
 * <p>Each edge is {@code (from, action) -> to}, restricted to a set of actor roles. A state
 * with no outgoing edge is terminal. The table is immutable once built and is the only
 * authority on whether a move is legal; clients may cache it for display hints but every
 * call is checked here.
 *
 * <p>Example:
 * <pre>
 * TransitionTable.builder(EntityType.QUOTE, QuoteStatus.class)
 *         .initial(QuoteStatus.REQUESTED, QuoteStatus.PENDING, QuoteStatus.SENT)
 *         .allow(QuoteStatus.SENT, WorkflowAction.ACCEPT, QuoteStatus.ACCEPTED, ActorRole.BUYER)
 *         .build();
 * </pre>
 *
 * @param <S> status enum of the entity
 */
public final class TransitionTable<S extends Enum<S>> {

    /**
     * One edge of the graph.
     */
    public record Transition<S extends Enum<S>>(S from, WorkflowAction action, Set<ActorRole> roles, S to) {

        public boolean permits(ActorRole role) {
            return roles.contains(role);
        }

        public boolean isSelfLoop() {
            return from == to;
        }
    }

    private final EntityType entityType;
    private final Class<S> statusType;
    private final Set<S> initialStates;
    private final Map<S, Map<WorkflowAction, Transition<S>>> edges;

    private TransitionTable(EntityType entityType, Class<S> statusType, Set<S> initialStates,
                            Map<S, Map<WorkflowAction, Transition<S>>> edges) {
        this.entityType = entityType;
        this.statusType = statusType;
        this.initialStates = Collections.unmodifiableSet(initialStates);
        this.edges = edges;
    }

    public static <S extends Enum<S>> Builder<S> builder(EntityType entityType, Class<S> statusType) {
        return new Builder<>(entityType, statusType);
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public Class<S> getStatusType() {
        return statusType;
    }

    public Set<S> getInitialStates() {
        return initialStates;
    }

    /**
     * Finds the edge for {@code action} leaving {@code from}, regardless of role.
     */
    public Optional<Transition<S>> find(S from, WorkflowAction action) {
        Map<WorkflowAction, Transition<S>> byAction = edges.get(from);
        return byAction == null ? Optional.empty() : Optional.ofNullable(byAction.get(action));
    }

    /**
     * Resolves the move or fails.
     *
     * @param entityId id of the entity, only used for the error details
     * @param from     current state
     * @param action   requested action
     * @param role     role the actor claims
     * @return the matching edge, permitted for {@code role}
     * @throws InvalidTransitionException if no edge leaves {@code from} for {@code action} or the
     *                                    edge does not admit {@code role}
     */
    public Transition<S> resolve(UUID entityId, S from, WorkflowAction action, ActorRole role) {
        Transition<S> transition = find(from, action).orElse(null);
        if (transition == null || !transition.permits(role)) {
            throw new InvalidTransitionException(entityType, entityId, from, action,
                    targetOf(action).orElse(null), role);
        }
        return transition;
    }

    public boolean isAllowed(S from, WorkflowAction action, ActorRole role) {
        return find(from, action).map(t -> t.permits(role)).orElse(false);
    }

    public boolean isTerminal(S state) {
        Map<WorkflowAction, Transition<S>> byAction = edges.get(state);
        return byAction == null || byAction.isEmpty();
    }

    /**
     * Actions the role may apply from {@code state}, in declaration order.
     */
    public List<WorkflowAction> allowedActions(S state, ActorRole role) {
        Map<WorkflowAction, Transition<S>> byAction = edges.get(state);
        if (byAction == null) {
            return List.of();
        }
        List<WorkflowAction> actions = new ArrayList<>();
        byAction.forEach((action, transition) -> {
            if (transition.permits(role)) {
                actions.add(action);
            }
        });
        return actions;
    }

    /**
     * Every state an entity of this type can ever hold: the initial states plus the targets of
     * all edges.
     */
    public Set<S> imageSet() {
        Set<S> image = EnumSet.noneOf(statusType);
        image.addAll(initialStates);
        edges.values().forEach(byAction -> byAction.values().forEach(t -> image.add(t.to())));
        return image;
    }

    public List<Transition<S>> transitions() {
        List<Transition<S>> all = new ArrayList<>();
        edges.values().forEach(byAction -> all.addAll(byAction.values()));
        return all;
    }

    /**
     * Target state of {@code action} when every edge labelled with it ends in the same state.
     * Used to name the requested state in rejection errors.
     */
    public Optional<S> targetOf(WorkflowAction action) {
        Set<S> targets = new LinkedHashSet<>();
        edges.values().forEach(byAction -> {
            Transition<S> transition = byAction.get(action);
            if (transition != null) {
                targets.add(transition.to());
            }
        });
        return targets.size() == 1 ? Optional.of(targets.iterator().next()) : Optional.empty();
    }

    public static final class Builder<S extends Enum<S>> {

        private final EntityType entityType;
        private final Class<S> statusType;
        private final Set<S> initialStates;
        private final Map<S, Map<WorkflowAction, Transition<S>>> edges;

        private Builder(EntityType entityType, Class<S> statusType) {
            this.entityType = entityType;
            this.statusType = statusType;
            this.initialStates = EnumSet.noneOf(statusType);
            this.edges = new EnumMap<>(statusType);
        }

        @SafeVarargs
        public final Builder<S> initial(S... states) {
            Collections.addAll(initialStates, states);
            return this;
        }

        public Builder<S> allow(S from, WorkflowAction action, S to, ActorRole... roles) {
            if (roles.length == 0) {
                throw new IllegalArgumentException("Edge " + from + " --" + action + "--> " + to + " has no roles");
            }
            Map<WorkflowAction, Transition<S>> byAction = edges.computeIfAbsent(from,
                    k -> new EnumMap<>(WorkflowAction.class));
            if (byAction.containsKey(action)) {
                throw new IllegalStateException(String.format("Duplicate %s edge %s --%s-->",
                        entityType, from, action));
            }
            byAction.put(action, new Transition<>(from, action, Collections.unmodifiableSet(EnumSet.of(roles[0], roles)), to));
            return this;
        }

        /**
         * Same action and roles from several states to one target.
         */
        public Builder<S> allowFrom(Set<S> froms, WorkflowAction action, S to, ActorRole... roles) {
            for (S from : froms) {
                allow(from, action, to, roles);
            }
            return this;
        }

        public TransitionTable<S> build() {
            if (initialStates.isEmpty()) {
                throw new IllegalStateException(entityType + " table declares no initial state");
            }
            Map<S, Map<WorkflowAction, Transition<S>>> frozen = new EnumMap<>(statusType);
            edges.forEach((from, byAction) -> frozen.put(from, Collections.unmodifiableMap(new EnumMap<>(byAction))));
            return new TransitionTable<>(entityType, statusType, initialStates, Collections.unmodifiableMap(frozen));
        }
    }
}
