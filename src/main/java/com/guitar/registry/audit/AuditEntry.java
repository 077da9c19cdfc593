package com.guitar.registry.audit;

import com.guitar.registry.core.model.EntityKind;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable audit record.
 *
 * @param entityKind kind of the affected row; {@code null} for batch-level entries
 * @param entityId   id of the affected row or review item; {@code null} for batch-level entries
 * @param batchId    correlation id of the ingestion call
 */
public record AuditEntry(
        String id,
        AuditAction action,
        EntityKind entityKind,
        String entityId,
        String actorId,
        String batchId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private EntityKind entityKind;
        private String entityId;
        private String actorId;
        private String batchId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder entityKind(EntityKind entityKind) {
            this.entityKind = entityKind;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder batchId(String batchId) {
            this.batchId = batchId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, entityKind, entityId, actorId, batchId, details, timestamp);
        }
    }
}
