package com.guitar.registry.pipeline;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.payload.IndividualGuitarPayload;
import com.guitar.registry.core.payload.ModelPayload;
import com.guitar.registry.core.payload.ModelReference;
import com.guitar.registry.core.payload.Submission;
import com.guitar.registry.matching.IndividualGuitarMatchFinder;
import com.guitar.registry.matching.MatchCandidate;
import com.guitar.registry.similarity.NameNormalizer;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.writer.IndividualGuitarWriter;
import com.guitar.registry.writer.MissingDependencyException;
import com.guitar.registry.writer.ReferenceResolver;
import com.guitar.registry.writer.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Guitars reference a catalog model, or carry free-text fallback fields when the model is not
 * catalogued. An unresolvable reference is tolerated only when a fallback manufacturer is given.
 */
public class IndividualGuitarResolvable implements ResolvableEntity<IndividualGuitarPayload> {
    private static final Logger log = LoggerFactory.getLogger(IndividualGuitarResolvable.class);

    private final IndividualGuitarMatchFinder finder;
    private final IndividualGuitarWriter writer;
    private final ReferenceResolver references;

    public IndividualGuitarResolvable(IndividualGuitarMatchFinder finder, IndividualGuitarWriter writer,
                                      ReferenceResolver references) {
        this.finder = finder;
        this.writer = writer;
        this.references = references;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.INDIVIDUAL_GUITAR;
    }

    @Override
    public IndividualGuitarPayload payload(Submission submission) {
        return submission.individualGuitar();
    }

    @Override
    public UUID resolveParent(CatalogTransaction tx, SubmissionContext context, IndividualGuitarPayload payload) {
        ModelReference reference = payload.modelReference();
        if (reference == null) {
            return null;
        }
        Optional<UUID> modelId = sameSubmissionModel(context, reference)
                .or(() -> references.resolveModel(tx, reference));
        if (modelId.isPresent()) {
            return modelId.get();
        }
        if (!payload.hasFallbackManufacturer()) {
            throw MissingDependencyException.model(reference);
        }
        log.debug("guitar.modelUnresolved model={} year={} fallbackManufacturer={}",
                reference.modelName(), reference.year(), payload.manufacturerNameFallback());
        return null;
    }

    private Optional<UUID> sameSubmissionModel(SubmissionContext context, ModelReference reference) {
        ModelPayload model = context.submission().model();
        if (model == null
                || !NameNormalizer.sameName(model.manufacturerName(), reference.manufacturerName())
                || !NameNormalizer.sameName(model.name(), reference.modelName())
                || !Objects.equals(model.year(), reference.year())) {
            return Optional.empty();
        }
        return context.resolvedId(EntityKind.MODEL);
    }

    @Override
    public List<MatchCandidate> findCandidates(CatalogTransaction tx, IndividualGuitarPayload payload, UUID modelId) {
        return finder.findCandidates(tx, payload, modelId);
    }

    @Override
    public WriteOutcome insert(CatalogTransaction tx, IndividualGuitarPayload payload, UUID modelId) {
        return writer.insert(tx, payload, modelId);
    }

    @Override
    public WriteOutcome update(CatalogTransaction tx, UUID targetId, IndividualGuitarPayload payload, UUID modelId) {
        return writer.update(tx, targetId, payload, modelId);
    }

    @Override
    public String conflictNote(MatchCandidate candidate) {
        return "Similar guitar found: " + candidate.label();
    }
}
