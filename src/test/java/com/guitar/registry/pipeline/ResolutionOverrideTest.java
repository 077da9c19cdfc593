package com.guitar.registry.pipeline;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.decision.ResolutionAction;
import com.guitar.registry.decision.ResolutionDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionOverrideTest {

    @Test
    @DisplayName("mergeInto should become an update of the target")
    void testMergeInto() {
        UUID target = UUID.randomUUID();

        ResolutionDecision decision = ResolutionOverride.mergeInto(EntityKind.MODEL, target).toDecision();

        assertEquals(ResolutionAction.UPDATE, decision.action());
        assertEquals(target, decision.targetId());
    }

    @Test
    @DisplayName("insertNew should become an insert")
    void testInsertNew() {
        ResolutionOverride override = ResolutionOverride.insertNew(EntityKind.MANUFACTURER);

        assertNull(override.targetId());
        assertEquals(ResolutionAction.INSERT, override.toDecision().action());
    }

    @Test
    @DisplayName("Should reject deferring overrides and updates without a target")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> new ResolutionOverride(EntityKind.MODEL, ResolutionAction.MANUAL_REVIEW, UUID.randomUUID()));
        assertThrows(IllegalArgumentException.class,
                () -> new ResolutionOverride(EntityKind.MODEL, ResolutionAction.UPDATE, null));
        assertThrows(NullPointerException.class,
                () -> new ResolutionOverride(null, ResolutionAction.INSERT, null));
    }
}
