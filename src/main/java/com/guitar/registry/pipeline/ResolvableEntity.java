package com.guitar.registry.pipeline;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.payload.Submission;
import com.guitar.registry.matching.MatchCandidate;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.writer.WriteOutcome;

import java.util.List;
import java.util.UUID;

/**
 * One stage of the submission pipeline: how a section of a given kind is matched and written.
 *
 * @param <P> the section payload type
 */
public interface ResolvableEntity<P> {

    EntityKind kind();

    /**
     * Returns this stage's section of the submission, or {@code null} when it is absent.
     */
    P payload(Submission submission);

    /**
     * Resolves the parent row the section hangs off (the manufacturer of a model, the model of
     * a guitar). Returns {@code null} when the kind has no parent or the parent is unknown and
     * the payload can do without it.
     *
     * @throws com.guitar.registry.writer.MissingDependencyException if a required parent is unknown
     */
    UUID resolveParent(CatalogTransaction tx, SubmissionContext context, P payload);

    /**
     * @return candidates ordered best first
     */
    List<MatchCandidate> findCandidates(CatalogTransaction tx, P payload, UUID parentId);

    WriteOutcome insert(CatalogTransaction tx, P payload, UUID parentId);

    WriteOutcome update(CatalogTransaction tx, UUID targetId, P payload, UUID parentId);

    /**
     * Describes the candidate that stopped the submission, e.g. {@code Similar model found: Les Paul (1959)}.
     */
    String conflictNote(MatchCandidate candidate);
}
