package com.guitar.registry.matching;

import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * An existing catalog row that may be the same real-world entity as an incoming payload.
 *
 * @param entityId id of the existing row
 * @param score    confidence; roughly in [0, 1] but additive bonuses may push it above 1
 * @param basis    what the score is grounded on
 * @param label    human-readable description used in conflict notes
 */
public record MatchCandidate(UUID entityId, double score, MatchBasis basis, String label) {

    /** Highest score first. */
    public static final Comparator<MatchCandidate> BY_SCORE_DESC =
            Comparator.comparingDouble(MatchCandidate::score).reversed();

    public MatchCandidate {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(basis, "basis is required");
        if (Double.isNaN(score) || score < 0) {
            throw new IllegalArgumentException("score must be >= 0, got " + score);
        }
    }
}
