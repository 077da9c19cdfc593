package com.guitar.registry.pipeline;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.decision.ResolutionAction;
import com.guitar.registry.decision.ResolutionDecision;
import com.guitar.registry.matching.MatchBasis;
import com.guitar.registry.matching.MatchCandidate;

import java.util.Objects;
import java.util.UUID;

/**
 * A reviewer's ruling for one entity kind of a submission, applied instead of the resolution policy.
 *
 * @param targetId row to merge into; required for {@code UPDATE}, ignored for {@code INSERT}
 */
public record ResolutionOverride(EntityKind kind, ResolutionAction action, UUID targetId) {

    public ResolutionOverride {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(action, "action is required");
        if (action == ResolutionAction.MANUAL_REVIEW) {
            throw new IllegalArgumentException("An override must settle the entity, not defer it");
        }
        if (action == ResolutionAction.UPDATE && targetId == null) {
            throw new IllegalArgumentException("An update override needs a target id");
        }
    }

    public static ResolutionOverride mergeInto(EntityKind kind, UUID targetId) {
        return new ResolutionOverride(kind, ResolutionAction.UPDATE, targetId);
    }

    public static ResolutionOverride insertNew(EntityKind kind) {
        return new ResolutionOverride(kind, ResolutionAction.INSERT, null);
    }

    ResolutionDecision toDecision() {
        if (action == ResolutionAction.INSERT) {
            return ResolutionDecision.insert(null);
        }
        return ResolutionDecision.update(new MatchCandidate(targetId, 1.0, MatchBasis.REVIEWER, "reviewer decision"));
    }
}
