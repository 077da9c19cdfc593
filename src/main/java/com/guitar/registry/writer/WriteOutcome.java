package com.guitar.registry.writer;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.decision.ResolutionAction;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Result of writing one entity.
 *
 * @param kind             kind of entity written
 * @param entityId         id of the inserted or updated row
 * @param action           {@link ResolutionAction#INSERT} or {@link ResolutionAction#UPDATE}
 * @param changedFields    fields changed by an update; empty for inserts and no-op updates
 * @param specificationIds ids of specification rows created alongside an insert
 */
public record WriteOutcome(EntityKind kind, UUID entityId, ResolutionAction action, List<String> changedFields,
                           List<UUID> specificationIds) {

    public WriteOutcome {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(action, "action is required");
        if (action == ResolutionAction.MANUAL_REVIEW) {
            throw new IllegalArgumentException("A write is either an insert or an update");
        }
        changedFields = changedFields != null ? List.copyOf(changedFields) : List.of();
        specificationIds = specificationIds != null ? List.copyOf(specificationIds) : List.of();
    }

    public static WriteOutcome inserted(EntityKind kind, UUID entityId, List<UUID> specificationIds) {
        return new WriteOutcome(kind, entityId, ResolutionAction.INSERT, List.of(), specificationIds);
    }

    public static WriteOutcome updated(EntityKind kind, UUID entityId, List<String> changedFields) {
        return new WriteOutcome(kind, entityId, ResolutionAction.UPDATE, changedFields, List.of());
    }

    /**
     * Returns the action string reported to callers, e.g. {@code "Model insert"}.
     */
    public String describe() {
        return kind.label() + " " + action.verb();
    }
}
