package com.guitar.registry.decision;

import com.guitar.registry.matching.MatchCandidate;

import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of the resolution policy for one entity.
 *
 * @param action    what to do
 * @param candidate best candidate considered, or {@code null} when there was none
 */
public record ResolutionDecision(ResolutionAction action, MatchCandidate candidate) {

    public ResolutionDecision {
        Objects.requireNonNull(action, "action is required");
        if (action != ResolutionAction.INSERT && candidate == null) {
            throw new IllegalArgumentException(action + " requires a candidate");
        }
    }

    public static ResolutionDecision insert(MatchCandidate bestCandidate) {
        return new ResolutionDecision(ResolutionAction.INSERT, bestCandidate);
    }

    public static ResolutionDecision update(MatchCandidate candidate) {
        return new ResolutionDecision(ResolutionAction.UPDATE, candidate);
    }

    public static ResolutionDecision manualReview(MatchCandidate candidate) {
        return new ResolutionDecision(ResolutionAction.MANUAL_REVIEW, candidate);
    }

    /**
     * Returns the id of the row to update or review.
     *
     * @throws IllegalStateException for an insert
     */
    public UUID targetId() {
        if (action == ResolutionAction.INSERT) {
            throw new IllegalStateException("An insert has no target");
        }
        return candidate.entityId();
    }

    public double score() {
        return candidate != null ? candidate.score() : 0.0;
    }
}
