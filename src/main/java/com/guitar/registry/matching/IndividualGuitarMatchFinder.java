package com.guitar.registry.matching;

import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.payload.IndividualGuitarPayload;
import com.guitar.registry.similarity.SerialNumberNormalizer;
import com.guitar.registry.store.CatalogTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Finds existing guitars that may be the same instrument as an incoming one.
 *
 * <p>Two tiers. A normalized serial number hit is conclusive (score 1.0) and ends the search.
 * Otherwise guitars are gathered either by shared catalog model or, without a model, by equal
 * fallback manufacturer text (narrowed by fallback model name and year estimate when given)
 * and scored on corroborating attributes.</p>
 */
public class IndividualGuitarMatchFinder {
    private static final Logger log = LoggerFactory.getLogger(IndividualGuitarMatchFinder.class);

    static final double SERIAL_MATCH_SCORE = 1.0;
    static final double PRODUCTION_DATE_BONUS = 0.5;
    static final double FALLBACK_MANUFACTURER_BASE = 0.3;
    static final double FALLBACK_MODEL_NAME_BONUS = 0.4;
    static final double YEAR_ESTIMATE_BONUS = 0.3;

    private final double minimumScore;

    public IndividualGuitarMatchFinder(double minimumScore) {
        this.minimumScore = minimumScore;
    }

    /**
     * @param modelId the resolved catalog model, or {@code null} when only fallback text is known
     */
    public List<MatchCandidate> findCandidates(CatalogTransaction tx, IndividualGuitarPayload incoming, UUID modelId) {
        String serial = SerialNumberNormalizer.normalize(incoming.serialNumber());
        if (serial != null) {
            List<IndividualGuitar> sameSerial = tx.findGuitarsBySerialNumber(serial);
            if (!sameSerial.isEmpty()) {
                IndividualGuitar existing = sameSerial.get(0);
                if (sameSerial.size() > 1) {
                    log.warn("guitar.serialCollision serial={} matches={}", serial, sameSerial.size());
                }
                return List.of(new MatchCandidate(existing.id(), SERIAL_MATCH_SCORE, MatchBasis.SERIAL_NUMBER,
                        "serial " + existing.serialNumber()));
            }
        }

        List<MatchCandidate> candidates = new ArrayList<>();
        if (modelId != null) {
            for (IndividualGuitar existing : tx.findGuitarsByModel(modelId)) {
                double score = productionDateScore(incoming, existing);
                addIfAboveMinimum(candidates, existing, score, MatchBasis.MODEL_REFERENCE);
            }
        } else if (incoming.hasFallbackManufacturer()) {
            for (IndividualGuitar existing : tx.findGuitarsByFallbackManufacturer(incoming.manufacturerNameFallback())) {
                if (!passesFallbackNarrowing(incoming, existing)) {
                    continue;
                }
                double score = productionDateScore(incoming, existing) + FALLBACK_MANUFACTURER_BASE;
                if (incoming.modelNameFallback() != null
                        && incoming.modelNameFallback().equalsIgnoreCase(existing.modelNameFallback())) {
                    score += FALLBACK_MODEL_NAME_BONUS;
                }
                if (incoming.yearEstimate() != null && incoming.yearEstimate().equals(existing.yearEstimate())) {
                    score += YEAR_ESTIMATE_BONUS;
                }
                addIfAboveMinimum(candidates, existing, score, MatchBasis.FALLBACK_TEXT);
            }
        }
        candidates.sort(MatchCandidate.BY_SCORE_DESC);
        return candidates;
    }

    private static boolean passesFallbackNarrowing(IndividualGuitarPayload incoming, IndividualGuitar existing) {
        if (incoming.modelNameFallback() != null
                && !incoming.modelNameFallback().equalsIgnoreCase(existing.modelNameFallback())) {
            return false;
        }
        return incoming.yearEstimate() == null || incoming.yearEstimate().equals(existing.yearEstimate());
    }

    private static double productionDateScore(IndividualGuitarPayload incoming, IndividualGuitar existing) {
        if (incoming.productionDate() != null && Objects.equals(incoming.productionDate(), existing.productionDate())) {
            return PRODUCTION_DATE_BONUS;
        }
        return 0.0;
    }

    private void addIfAboveMinimum(List<MatchCandidate> candidates, IndividualGuitar existing,
                                   double score, MatchBasis basis) {
        if (score >= minimumScore) {
            candidates.add(new MatchCandidate(existing.id(), score, basis, describe(existing)));
        }
    }

    private static String describe(IndividualGuitar guitar) {
        if (guitar.nickname() != null) {
            return guitar.nickname();
        }
        if (guitar.serialNumber() != null) {
            return "serial " + guitar.serialNumber();
        }
        return guitar.id().toString();
    }
}
