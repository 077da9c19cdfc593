package com.guitar.registry.pipeline;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.payload.ManufacturerPayload;
import com.guitar.registry.core.payload.Submission;
import com.guitar.registry.matching.ManufacturerMatchFinder;
import com.guitar.registry.matching.MatchCandidate;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.writer.ManufacturerWriter;
import com.guitar.registry.writer.WriteOutcome;

import java.util.List;
import java.util.UUID;

public class ManufacturerResolvable implements ResolvableEntity<ManufacturerPayload> {

    private final ManufacturerMatchFinder finder;
    private final ManufacturerWriter writer;

    public ManufacturerResolvable(ManufacturerMatchFinder finder, ManufacturerWriter writer) {
        this.finder = finder;
        this.writer = writer;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.MANUFACTURER;
    }

    @Override
    public ManufacturerPayload payload(Submission submission) {
        return submission.manufacturer();
    }

    @Override
    public UUID resolveParent(CatalogTransaction tx, SubmissionContext context, ManufacturerPayload payload) {
        return null;
    }

    @Override
    public List<MatchCandidate> findCandidates(CatalogTransaction tx, ManufacturerPayload payload, UUID parentId) {
        return finder.findCandidates(tx, payload);
    }

    @Override
    public WriteOutcome insert(CatalogTransaction tx, ManufacturerPayload payload, UUID parentId) {
        return writer.insert(tx, payload);
    }

    @Override
    public WriteOutcome update(CatalogTransaction tx, UUID targetId, ManufacturerPayload payload, UUID parentId) {
        return writer.update(tx, targetId, payload);
    }

    @Override
    public String conflictNote(MatchCandidate candidate) {
        return "Similar manufacturer found: " + candidate.label();
    }
}
