package com.guitar.registry.pipeline;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.payload.ManufacturerPayload;
import com.guitar.registry.core.payload.ModelPayload;
import com.guitar.registry.core.payload.Submission;
import com.guitar.registry.matching.MatchCandidate;
import com.guitar.registry.matching.ModelMatchFinder;
import com.guitar.registry.similarity.NameNormalizer;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.writer.ModelWriter;
import com.guitar.registry.writer.ReferenceResolver;
import com.guitar.registry.writer.WriteOutcome;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Models hang off a manufacturer. When the same submission carried that manufacturer, the id it
 * resolved to is used even if the row's stored name differs from the submitted one.
 */
public class ModelResolvable implements ResolvableEntity<ModelPayload> {

    private final ModelMatchFinder finder;
    private final ModelWriter writer;
    private final ReferenceResolver references;

    public ModelResolvable(ModelMatchFinder finder, ModelWriter writer, ReferenceResolver references) {
        this.finder = finder;
        this.writer = writer;
        this.references = references;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.MODEL;
    }

    @Override
    public ModelPayload payload(Submission submission) {
        return submission.model();
    }

    @Override
    public UUID resolveParent(CatalogTransaction tx, SubmissionContext context, ModelPayload payload) {
        ManufacturerPayload manufacturer = context.submission().manufacturer();
        Optional<UUID> resolved = context.resolvedId(EntityKind.MANUFACTURER);
        if (manufacturer != null && resolved.isPresent()
                && NameNormalizer.sameName(manufacturer.name(), payload.manufacturerName())) {
            return resolved.get();
        }
        return references.requireManufacturer(tx, payload.manufacturerName());
    }

    @Override
    public List<MatchCandidate> findCandidates(CatalogTransaction tx, ModelPayload payload, UUID manufacturerId) {
        return finder.findCandidates(tx, manufacturerId, payload);
    }

    @Override
    public WriteOutcome insert(CatalogTransaction tx, ModelPayload payload, UUID manufacturerId) {
        return writer.insert(tx, manufacturerId, payload);
    }

    @Override
    public WriteOutcome update(CatalogTransaction tx, UUID targetId, ModelPayload payload, UUID manufacturerId) {
        return writer.update(tx, targetId, payload);
    }

    @Override
    public String conflictNote(MatchCandidate candidate) {
        return "Similar model found: " + candidate.label();
    }
}
