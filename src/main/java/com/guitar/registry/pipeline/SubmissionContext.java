package com.guitar.registry.pipeline;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.payload.Submission;
import com.guitar.registry.writer.WriteOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Mutable state of one submission while its sections are resolved and written.
 * Later sections read the ids earlier sections resolved.
 */
public class SubmissionContext {

    private final int index;
    private final String batchId;
    private final Submission submission;
    private final Map<EntityKind, ResolutionOverride> overrides = new EnumMap<>(EntityKind.class);
    private final Map<EntityKind, UUID> resolvedIds = new EnumMap<>(EntityKind.class);
    private final List<WriteOutcome> writes = new ArrayList<>();

    public SubmissionContext(int index, String batchId, Submission submission, List<ResolutionOverride> overrides) {
        this.index = index;
        this.batchId = batchId;
        this.submission = submission;
        for (ResolutionOverride override : overrides) {
            this.overrides.put(override.kind(), override);
        }
    }

    public int index() {
        return index;
    }

    public String batchId() {
        return batchId;
    }

    public Submission submission() {
        return submission;
    }

    public Optional<ResolutionOverride> overrideFor(EntityKind kind) {
        return Optional.ofNullable(overrides.get(kind));
    }

    public Optional<UUID> resolvedId(EntityKind kind) {
        return Optional.ofNullable(resolvedIds.get(kind));
    }

    void record(WriteOutcome write) {
        writes.add(write);
        resolvedIds.put(write.kind(), write.entityId());
    }

    public List<WriteOutcome> writes() {
        return Collections.unmodifiableList(writes);
    }
}
