package com.guitar.registry.api;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.FailureKind;
import com.guitar.registry.decision.ResolutionAction;
import com.guitar.registry.matching.MatchCandidate;
import com.guitar.registry.writer.WriteOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of one submission.
 *
 * <p>{@code idsCreated} holds the ids of inserted rows under the keys {@code manufacturer},
 * {@code model}, {@code model_specifications}, {@code individual_guitar} and
 * {@code guitar_specifications} (the specification keys map to lists). {@code resolvedIds}
 * holds the id of every entity the submission inserted or updated, keyed by section name.
 * A failed submission wrote nothing, so its action and id maps are empty.</p>
 *
 * @param writes          the writes behind the action strings; not part of the wire format
 * @param reviewKind      kind that needs manual review, or {@code null}
 * @param reviewCandidate existing row the reviewer must compare against, or {@code null}
 */
public record SubmissionResult(
        int index,
        boolean success,
        List<String> actionsTaken,
        List<String> conflicts,
        Map<String, Object> idsCreated,
        boolean manualReviewNeeded,
        FailureKind failureKind,
        String error,
        Map<String, UUID> resolvedIds,
        List<WriteOutcome> writes,
        EntityKind reviewKind,
        MatchCandidate reviewCandidate
) implements IngestionReport {

    public SubmissionResult {
        actionsTaken = actionsTaken != null ? List.copyOf(actionsTaken) : List.of();
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        idsCreated = idsCreated != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(idsCreated)) : Map.of();
        resolvedIds = resolvedIds != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(resolvedIds)) : Map.of();
        writes = writes != null ? List.copyOf(writes) : List.of();
        if (success && failureKind != null) {
            throw new IllegalArgumentException("a successful result has no failure kind");
        }
    }

    /**
     * Builds the result of a submission whose writes all went through.
     */
    public static SubmissionResult succeeded(int index, List<WriteOutcome> writes) {
        Map<String, Object> idsCreated = new LinkedHashMap<>();
        Map<String, UUID> resolvedIds = new LinkedHashMap<>();
        for (WriteOutcome write : writes) {
            String key = write.kind().sectionName();
            resolvedIds.put(key, write.entityId());
            if (write.action() == ResolutionAction.INSERT) {
                idsCreated.put(key, write.entityId());
                if (!write.specificationIds().isEmpty()) {
                    idsCreated.put(specificationKey(write.kind()), write.specificationIds());
                }
            }
        }
        List<String> actions = writes.stream().map(WriteOutcome::describe).toList();
        return new SubmissionResult(index, true, actions, List.of(), idsCreated, false,
                null, null, resolvedIds, writes, null, null);
    }

    /**
     * Builds the result of a submission that was stopped and rolled back.
     */
    public static SubmissionResult failed(int index, FailureKind failureKind, List<String> conflicts, String error) {
        Objects.requireNonNull(failureKind, "failureKind is required");
        return new SubmissionResult(index, false, List.of(), conflicts, Map.of(), false,
                failureKind, error, Map.of(), List.of(), null, null);
    }

    /**
     * Builds the result of a submission stopped for manual review.
     */
    public static SubmissionResult needsReview(int index, EntityKind kind, MatchCandidate candidate, String conflict) {
        Objects.requireNonNull(kind, "kind is required");
        return new SubmissionResult(index, false, List.of(), List.of(conflict), Map.of(), true,
                FailureKind.MANUAL_REVIEW_REQUIRED, conflict, Map.of(), List.of(), kind, candidate);
    }

    static String specificationKey(EntityKind kind) {
        return switch (kind) {
            case MODEL -> "model_specifications";
            case INDIVIDUAL_GUITAR -> "guitar_specifications";
            case MANUFACTURER -> throw new IllegalArgumentException("Manufacturers have no specifications");
        };
    }
}
