package com.guitar.registry.pipeline;

import com.guitar.registry.api.IngestionOptions;
import com.guitar.registry.core.payload.Submission;
import com.guitar.registry.decision.ResolutionDecision;
import com.guitar.registry.decision.ResolutionPolicy;
import com.guitar.registry.matching.IndividualGuitarMatchFinder;
import com.guitar.registry.matching.ManufacturerMatchFinder;
import com.guitar.registry.matching.MatchCandidate;
import com.guitar.registry.matching.ModelMatchFinder;
import com.guitar.registry.metrics.MetricsService;
import com.guitar.registry.similarity.NameSimilarity;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.validation.PayloadMapper;
import com.guitar.registry.validation.SchemaValidator;
import com.guitar.registry.writer.IndividualGuitarWriter;
import com.guitar.registry.writer.ManufacturerWriter;
import com.guitar.registry.writer.ModelWriter;
import com.guitar.registry.writer.ReferenceResolver;
import com.guitar.registry.writer.SpecificationWriter;
import com.guitar.registry.writer.WriteOutcome;
import com.guitar.registry.writer.WriteStamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Validates a raw submission and runs its sections through match, decide and write, in the
 * order manufacturer, model, individual guitar.
 *
 * <p>The pipeline never commits or rolls back; the caller owns the transaction and undoes a
 * failed submission's writes. Failures surface as
 * {@link com.guitar.registry.core.IngestionException} subclasses, or as any other
 * {@link RuntimeException} for unexpected errors.</p>
 */
public class SubmissionPipeline {
    private static final Logger log = LoggerFactory.getLogger(SubmissionPipeline.class);

    private final SchemaValidator validator;
    private final PayloadMapper mapper;
    private final ResolutionPolicy policy;
    private final List<ResolvableEntity<?>> stages;
    private final MetricsService metrics;

    public SubmissionPipeline(IngestionOptions options, WriteStamp stamp, MetricsService metrics) {
        this(new SchemaValidator(), new PayloadMapper(),
                new ResolutionPolicy(options.getUpdateThreshold(), options.getReviewThreshold()),
                defaultStages(options, stamp), metrics);
    }

    public SubmissionPipeline(SchemaValidator validator, PayloadMapper mapper, ResolutionPolicy policy,
                              List<ResolvableEntity<?>> stages, MetricsService metrics) {
        this.validator = validator;
        this.mapper = mapper;
        this.policy = policy;
        this.stages = List.copyOf(stages);
        this.metrics = metrics;
    }

    private static List<ResolvableEntity<?>> defaultStages(IngestionOptions options, WriteStamp stamp) {
        NameSimilarity similarity = new NameSimilarity();
        ReferenceResolver references = new ReferenceResolver(stamp);
        SpecificationWriter specifications = new SpecificationWriter(stamp);
        return List.of(
                new ManufacturerResolvable(
                        new ManufacturerMatchFinder(similarity, options.getManufacturerMatchThreshold()),
                        new ManufacturerWriter(stamp)),
                new ModelResolvable(
                        new ModelMatchFinder(similarity, options.getModelMatchThreshold()),
                        new ModelWriter(stamp, references, specifications),
                        references),
                new IndividualGuitarResolvable(
                        new IndividualGuitarMatchFinder(options.getGuitarMatchThreshold()),
                        new IndividualGuitarWriter(stamp, specifications),
                        references));
    }

    /**
     * Checks the raw submission against the section schemas and maps it to typed payloads.
     * Touches no catalog state.
     *
     * @throws com.guitar.registry.validation.SchemaViolationException if the submission is malformed
     */
    public Submission parse(Object raw) {
        validator.validateSubmission(raw);
        return mapper.toSubmission((Map<?, ?>) raw);
    }

    /**
     * Resolves and writes every section present in the context's submission.
     *
     * @return the writes, in section order
     */
    public List<WriteOutcome> apply(CatalogTransaction tx, SubmissionContext context) {
        for (ResolvableEntity<?> stage : stages) {
            resolve(stage, tx, context);
        }
        return context.writes();
    }

    private <P> void resolve(ResolvableEntity<P> stage, CatalogTransaction tx, SubmissionContext context) {
        P payload = stage.payload(context.submission());
        if (payload == null) {
            return;
        }
        UUID parentId = stage.resolveParent(tx, context, payload);
        ResolutionDecision decision;
        if (context.overrideFor(stage.kind()).isPresent()) {
            decision = context.overrideFor(stage.kind()).get().toDecision();
            log.debug("entity.overridden kind={} action={}", stage.kind(), decision.action());
        } else {
            List<MatchCandidate> candidates = stage.findCandidates(tx, payload, parentId);
            if (!candidates.isEmpty()) {
                metrics.recordMatchScore(stage.kind(), candidates.get(0).score());
            }
            decision = policy.decide(stage.kind(), candidates);
            log.debug("entity.resolved kind={} action={} score={} candidates={}",
                    stage.kind(), decision.action(), decision.score(), candidates.size());
        }

        WriteOutcome write = switch (decision.action()) {
            case INSERT -> stage.insert(tx, payload, parentId);
            case UPDATE -> stage.update(tx, decision.targetId(), payload, parentId);
            case MANUAL_REVIEW -> throw new ManualReviewRequiredException(
                    stage.kind(), decision.candidate(), stage.conflictNote(decision.candidate()));
        };
        context.record(write);
    }
}
