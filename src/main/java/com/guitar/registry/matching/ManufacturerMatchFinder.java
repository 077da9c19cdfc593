package com.guitar.registry.matching;

import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.payload.ManufacturerPayload;
import com.guitar.registry.similarity.NameSimilarity;
import com.guitar.registry.store.CatalogTransaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds existing manufacturers resembling an incoming one. Defunct manufacturers are never
 * candidates. Score is name similarity plus a bonus for each corroborating attribute.
 */
public class ManufacturerMatchFinder {

    static final double COUNTRY_BONUS = 0.1;
    static final double FOUNDED_YEAR_BONUS = 0.1;

    private final NameSimilarity nameSimilarity;
    private final double minimumScore;

    public ManufacturerMatchFinder(NameSimilarity nameSimilarity, double minimumScore) {
        this.nameSimilarity = nameSimilarity;
        this.minimumScore = minimumScore;
    }

    /**
     * @return candidates scoring at least the minimum, best first
     */
    public List<MatchCandidate> findCandidates(CatalogTransaction tx, ManufacturerPayload incoming) {
        List<MatchCandidate> candidates = new ArrayList<>();
        for (Manufacturer existing : tx.findManufacturerCandidates()) {
            double score = nameSimilarity.score(incoming.name(), existing.name());
            if (incoming.country() != null && incoming.country().equalsIgnoreCase(existing.country())) {
                score += COUNTRY_BONUS;
            }
            if (incoming.foundedYear() != null && Objects.equals(incoming.foundedYear(), existing.foundedYear())) {
                score += FOUNDED_YEAR_BONUS;
            }
            if (score >= minimumScore) {
                candidates.add(new MatchCandidate(existing.id(), score, MatchBasis.NAME, existing.name()));
            }
        }
        candidates.sort(MatchCandidate.BY_SCORE_DESC);
        return candidates;
    }
}
