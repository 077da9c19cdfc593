package com.guitar.registry.matching;

import com.guitar.registry.core.model.GuitarModel;
import com.guitar.registry.core.payload.ModelPayload;
import com.guitar.registry.similarity.NameSimilarity;
import com.guitar.registry.store.CatalogTransaction;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Finds existing models of one manufacturer resembling an incoming model.
 * Year is a hard discriminator: a model from a different year is never a candidate,
 * whatever its name. The score is not clamped to 1.
 */
public class ModelMatchFinder {

    static final double YEAR_BONUS = 0.3;

    private final NameSimilarity nameSimilarity;
    private final double minimumScore;

    public ModelMatchFinder(NameSimilarity nameSimilarity, double minimumScore) {
        this.nameSimilarity = nameSimilarity;
        this.minimumScore = minimumScore;
    }

    public List<MatchCandidate> findCandidates(CatalogTransaction tx, UUID manufacturerId, ModelPayload incoming) {
        List<MatchCandidate> candidates = new ArrayList<>();
        for (GuitarModel existing : tx.findModelsByManufacturer(manufacturerId)) {
            if (incoming.year() != null && incoming.year() != existing.year()) {
                continue;
            }
            double score = nameSimilarity.score(incoming.name(), existing.name());
            if (incoming.year() != null) {
                score += YEAR_BONUS;
            }
            if (score >= minimumScore) {
                candidates.add(new MatchCandidate(existing.id(), score, MatchBasis.NAME,
                        existing.name() + " (" + existing.year() + ")"));
            }
        }
        candidates.sort(MatchCandidate.BY_SCORE_DESC);
        return candidates;
    }
}
