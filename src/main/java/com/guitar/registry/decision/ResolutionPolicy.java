package com.guitar.registry.decision;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.matching.MatchBasis;
import com.guitar.registry.matching.MatchCandidate;

import java.util.List;

/**
 * Maps an entity kind and its ranked candidates to a {@link ResolutionDecision}.
 * Pure function of its inputs; it never rejects.
 *
 * <ul>
 *   <li>Manufacturers and models: score &ge; update threshold merges, score &ge; review
 *       threshold goes to manual review, anything lower inserts.</li>
 *   <li>Individual guitars merge only on a serial number match. Any other candidate,
 *       however well it scores, leads to an insert.</li>
 * </ul>
 */
public class ResolutionPolicy {

    private final double updateThreshold;
    private final double reviewThreshold;

    public ResolutionPolicy(double updateThreshold, double reviewThreshold) {
        if (reviewThreshold > updateThreshold) {
            throw new IllegalArgumentException("reviewThreshold must be <= updateThreshold");
        }
        this.updateThreshold = updateThreshold;
        this.reviewThreshold = reviewThreshold;
    }

    /**
     * @param candidates candidates ordered best first; may be empty
     */
    public ResolutionDecision decide(EntityKind kind, List<MatchCandidate> candidates) {
        MatchCandidate best = candidates.isEmpty() ? null : candidates.get(0);
        if (best == null) {
            return ResolutionDecision.insert(null);
        }
        if (kind == EntityKind.INDIVIDUAL_GUITAR) {
            return best.basis() == MatchBasis.SERIAL_NUMBER
                    ? ResolutionDecision.update(best)
                    : ResolutionDecision.insert(best);
        }
        if (best.score() >= updateThreshold) {
            return ResolutionDecision.update(best);
        }
        if (best.score() >= reviewThreshold) {
            return ResolutionDecision.manualReview(best);
        }
        return ResolutionDecision.insert(best);
    }

    public double getUpdateThreshold() {
        return updateThreshold;
    }

    public double getReviewThreshold() {
        return reviewThreshold;
    }
}
