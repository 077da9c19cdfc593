package com.guitar.registry.pipeline;

import com.guitar.registry.core.IngestionException;
import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.FailureKind;
import com.guitar.registry.matching.MatchCandidate;

/**
 * Stops a submission whose best candidate is plausible but not confident enough to merge into.
 */
public class ManualReviewRequiredException extends IngestionException {

    private final EntityKind entityKind;
    private final MatchCandidate candidate;

    public ManualReviewRequiredException(EntityKind entityKind, MatchCandidate candidate, String note) {
        super(entityKind.label() + " conflict: " + note);
        this.entityKind = entityKind;
        this.candidate = candidate;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public MatchCandidate getCandidate() {
        return candidate;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.MANUAL_REVIEW_REQUIRED;
    }
}
