package com.guitar.registry.api;

import com.guitar.registry.audit.AuditService;
import com.guitar.registry.batch.BatchCommitPolicy;
import com.guitar.registry.batch.BatchCoordinator;
import com.guitar.registry.bulk.IngestionReportWriter;
import com.guitar.registry.bulk.JsonSubmissionReader;
import com.guitar.registry.core.model.FailureKind;
import com.guitar.registry.metrics.MetricsService;
import com.guitar.registry.metrics.NoOpMetricsService;
import com.guitar.registry.pipeline.ResolutionOverride;
import com.guitar.registry.pipeline.SubmissionPipeline;
import com.guitar.registry.review.InMemoryReviewQueue;
import com.guitar.registry.review.ReviewQueue;
import com.guitar.registry.review.ReviewService;
import com.guitar.registry.store.CatalogStore;
import com.guitar.registry.tracing.NoOpTracingService;
import com.guitar.registry.tracing.TracingService;
import com.guitar.registry.writer.WriteStamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for ingesting manufacturer, model and individual guitar submissions into the catalog.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CatalogIngestor ingestor = CatalogIngestor.builder()
 *     .store(new InMemoryCatalogStore())
 *     .build();
 *
 * SubmissionResult result = ingestor.ingest(Map.of(
 *     "manufacturer", Map.of("name", "Gibson Guitar Corporation", "country", "USA")));
 *
 * BatchIngestionResult batch = ingestor.ingestBatch(List.of(first, second));
 *
 * IngestionReport report = ingestor.ingestJson(json);
 * String out = ingestor.toJson(report);
 * </pre>
 *
 * <p>Each call runs in its own catalog transaction; see {@link BatchCoordinator} for the commit rules.
 * Submissions stopped for manual review are queued and resolved through {@link #getReviewService()}.</p>
 */
public class CatalogIngestor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CatalogIngestor.class);

    private final CatalogStore store;
    private final IngestionOptions options;
    private final BatchCoordinator coordinator;
    private final AuditService auditService;
    private final ReviewService reviewService;
    private final JsonSubmissionReader reader;
    private final IngestionReportWriter writer;

    private CatalogIngestor(Builder builder) {
        this.store = builder.store;
        this.options = builder.options;
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService(clock);
        ReviewQueue reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();

        WriteStamp stamp = new WriteStamp(options.getCreatedBy(), clock);
        SubmissionPipeline pipeline = new SubmissionPipeline(options, stamp, metrics);
        this.coordinator = new BatchCoordinator(store, pipeline, new BatchCommitPolicy(options.getMaxFailureRate()),
                options.getMaxBatchSize(), options.getCreatedBy(), metrics, tracing, auditService, reviewQueue, clock);
        this.reviewService = new ReviewService(reviewQueue, auditService, this::replay, clock);
        this.reader = new JsonSubmissionReader();
        this.writer = new IngestionReportWriter();
        log.info("ingestor.created options={}", options);
    }

    /**
     * Ingests one submission.
     *
     * @param submission sections keyed {@code manufacturer}, {@code model}, {@code individual_guitar}
     * @throws IllegalArgumentException if {@code submission} is null
     */
    public SubmissionResult ingest(Map<String, ?> submission) {
        if (submission == null) {
            throw new IllegalArgumentException("submission must not be null");
        }
        return single(submission, List.of());
    }

    /**
     * Ingests submissions in order within one transaction. Elements that are not maps fail
     * validation individually.
     *
     * @throws IllegalArgumentException if {@code submissions} is null or larger than the configured maximum
     */
    public BatchIngestionResult ingestBatch(List<?> submissions) {
        if (submissions == null) {
            throw new IllegalArgumentException("submissions must not be null");
        }
        return coordinator.process(submissions, true, List.of());
    }

    /**
     * Ingests a JSON document: an object is ingested as one submission, an array as a batch.
     *
     * @return a {@link SubmissionResult} or a {@link BatchIngestionResult}
     * @throws IllegalArgumentException if the document is neither an object nor an array
     */
    public IngestionReport ingestJson(String json) {
        return ingestDocument(reader.read(json));
    }

    public IngestionReport ingestJson(InputStream json) {
        return ingestDocument(reader.read(json));
    }

    private IngestionReport ingestDocument(JsonSubmissionReader.SubmissionDocument document) {
        if (document.batchMode()) {
            return coordinator.process(document.submissions(), true, List.of());
        }
        return single(document.submissions().get(0), List.of());
    }

    public String toJson(IngestionReport report) {
        return writer.toJson(report);
    }

    private SubmissionResult replay(Map<String, Object> submission, List<ResolutionOverride> overrides) {
        return single(submission, overrides);
    }

    private SubmissionResult single(Object submission, List<ResolutionOverride> overrides) {
        BatchIngestionResult outcome = coordinator.process(Collections.singletonList(submission), false, overrides);
        if (outcome.error() != null) {
            return SubmissionResult.failed(0, FailureKind.PROCESSING_ERROR, List.of(outcome.error()), outcome.error());
        }
        return outcome.results().get(0);
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public IngestionOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        store.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogStore store;
        private IngestionOptions options = IngestionOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuditService auditService;
        private ReviewQueue reviewQueue;
        private Clock clock;

        public Builder store(CatalogStore store) {
            this.store = store;
            return this;
        }

        public Builder options(IngestionOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        /**
         * Clock for row timestamps, audit entries and review items.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CatalogIngestor build() {
            Objects.requireNonNull(store, "store is required");
            Objects.requireNonNull(options, "options is required");
            return new CatalogIngestor(this);
        }
    }
}
