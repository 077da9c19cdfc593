package com.guitar.registry.audit;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.decision.ResolutionAction;
import com.guitar.registry.writer.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, in-memory audit trail. Entries are never updated or removed.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public AuditService() {
        this(Clock.systemUTC());
    }

    public AuditService(Clock clock) {
        this.clock = clock;
    }

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} entityKind={} entityId={} batchId={}",
                entry.action(), entry.entityKind(), entry.entityId(), entry.batchId());
        return entry;
    }

    /**
     * Records the insert or update of one committed row.
     */
    public AuditEntry recordWrite(WriteOutcome write, String actorId, String batchId) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (write.action() == ResolutionAction.UPDATE) {
            details.put("changedFields", write.changedFields());
        }
        if (!write.specificationIds().isEmpty()) {
            details.put("specificationCount", write.specificationIds().size());
        }
        return record(AuditEntry.builder()
                .action(write.action() == ResolutionAction.INSERT
                        ? AuditAction.ENTITY_INSERTED : AuditAction.ENTITY_UPDATED)
                .entityKind(write.kind())
                .entityId(write.entityId().toString())
                .actorId(actorId)
                .batchId(batchId)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    public AuditEntry record(AuditAction action, EntityKind entityKind, String entityId, String actorId,
                             String batchId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .entityKind(entityKind)
                .entityId(entityId)
                .actorId(actorId)
                .batchId(batchId)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    public List<AuditEntry> getEntriesForEntity(String entityId) {
        return entries.stream()
                .filter(e -> entityId.equals(e.entityId()))
                .toList();
    }

    public List<AuditEntry> getEntriesForBatch(String batchId) {
        return entries.stream()
                .filter(e -> batchId.equals(e.batchId()))
                .toList();
    }

    public int size() {
        return entries.size();
    }
}
