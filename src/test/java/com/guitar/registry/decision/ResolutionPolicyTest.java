package com.guitar.registry.decision;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.matching.MatchBasis;
import com.guitar.registry.matching.MatchCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionPolicyTest {

    private ResolutionPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new ResolutionPolicy(0.95, 0.85);
    }

    private static MatchCandidate candidate(double score, MatchBasis basis) {
        return new MatchCandidate(UUID.randomUUID(), score, basis, "candidate");
    }

    @Test
    @DisplayName("Should insert when there are no candidates")
    void testNoCandidates() {
        ResolutionDecision decision = policy.decide(EntityKind.MANUFACTURER, List.of());

        assertEquals(ResolutionAction.INSERT, decision.action());
        assertNull(decision.candidate());
        assertEquals(0.0, decision.score());
    }

    @Test
    @DisplayName("Should update at or above the update threshold")
    void testUpdate() {
        MatchCandidate best = candidate(0.95, MatchBasis.NAME);

        ResolutionDecision decision = policy.decide(EntityKind.MODEL, List.of(best, candidate(0.9, MatchBasis.NAME)));

        assertEquals(ResolutionAction.UPDATE, decision.action());
        assertEquals(best.entityId(), decision.targetId());
    }

    @Test
    @DisplayName("Should request manual review between the thresholds")
    void testManualReview() {
        assertEquals(ResolutionAction.MANUAL_REVIEW,
                policy.decide(EntityKind.MANUFACTURER, List.of(candidate(0.85, MatchBasis.NAME))).action());
        assertEquals(ResolutionAction.MANUAL_REVIEW,
                policy.decide(EntityKind.MANUFACTURER, List.of(candidate(0.9499, MatchBasis.NAME))).action());
    }

    @Test
    @DisplayName("Should insert below the review threshold")
    void testInsertBelowReview() {
        ResolutionDecision decision = policy.decide(EntityKind.MANUFACTURER, List.of(candidate(0.84, MatchBasis.NAME)));

        assertEquals(ResolutionAction.INSERT, decision.action());
        assertNotNull(decision.candidate());
        assertThrows(IllegalStateException.class, decision::targetId);
    }

    @Test
    @DisplayName("Guitars should only merge on a serial number match")
    void testGuitarSerialOnly() {
        assertEquals(ResolutionAction.UPDATE, policy.decide(EntityKind.INDIVIDUAL_GUITAR,
                List.of(candidate(1.0, MatchBasis.SERIAL_NUMBER))).action());
        assertEquals(ResolutionAction.INSERT, policy.decide(EntityKind.INDIVIDUAL_GUITAR,
                List.of(candidate(1.0, MatchBasis.FALLBACK_TEXT))).action());
        assertEquals(ResolutionAction.INSERT, policy.decide(EntityKind.INDIVIDUAL_GUITAR,
                List.of(candidate(0.9, MatchBasis.MODEL_REFERENCE))).action());
    }

    @Test
    @DisplayName("Should reject a review threshold above the update threshold")
    void testInvalidThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new ResolutionPolicy(0.8, 0.9));
    }

    @Test
    @DisplayName("Should describe actions with a lower-case verb")
    void testVerb() {
        assertEquals("insert", ResolutionAction.INSERT.verb());
        assertEquals("update", ResolutionAction.UPDATE.verb());
    }
}
