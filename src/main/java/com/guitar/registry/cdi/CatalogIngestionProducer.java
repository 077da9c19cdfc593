package com.guitar.registry.cdi;

import com.guitar.registry.api.CatalogIngestor;
import com.guitar.registry.api.IngestionOptions;
import com.guitar.registry.metrics.MetricsService;
import com.guitar.registry.metrics.MicrometerMetricsService;
import com.guitar.registry.metrics.NoOpMetricsService;
import com.guitar.registry.review.ReviewService;
import com.guitar.registry.store.CatalogStore;
import com.guitar.registry.store.JdbcCatalogStore;
import com.guitar.registry.tracing.NoOpTracingService;
import com.guitar.registry.tracing.OpenTelemetryTracingService;
import com.guitar.registry.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * CDI producer that wires the ingestion engine from MicroProfile Config properties.
 *
 * <p>The container must provide a {@link DataSource} for the catalog database. A
 * {@link MeterRegistry} or an OpenTelemetry {@link Tracer}, when the container has one,
 * is picked up for metrics and tracing.</p>
 *
 * <pre>
 * guitar-registry.ingestion.update-threshold=0.95
 * guitar-registry.ingestion.review-threshold=0.85
 * guitar-registry.ingestion.max-batch-size=10000
 * </pre>
 */
@ApplicationScoped
public class CatalogIngestionProducer {

    private static final Logger log = LoggerFactory.getLogger(CatalogIngestionProducer.class);

    // ── Resolution thresholds ─────────────────────────────────

    @Inject
    @ConfigProperty(name = "guitar-registry.ingestion.update-threshold", defaultValue = "0.95")
    double updateThreshold;

    @Inject
    @ConfigProperty(name = "guitar-registry.ingestion.review-threshold", defaultValue = "0.85")
    double reviewThreshold;

    // ── Candidate cut-offs ────────────────────────────────────

    @Inject
    @ConfigProperty(name = "guitar-registry.ingestion.manufacturer-match-threshold", defaultValue = "0.7")
    double manufacturerMatchThreshold;

    @Inject
    @ConfigProperty(name = "guitar-registry.ingestion.model-match-threshold", defaultValue = "0.8")
    double modelMatchThreshold;

    @Inject
    @ConfigProperty(name = "guitar-registry.ingestion.guitar-match-threshold", defaultValue = "0.5")
    double guitarMatchThreshold;

    // ── Batches ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "guitar-registry.ingestion.max-failure-rate", defaultValue = "0.5")
    double maxFailureRate;

    @Inject
    @ConfigProperty(name = "guitar-registry.ingestion.max-batch-size", defaultValue = "10000")
    int maxBatchSize;

    @Inject
    @ConfigProperty(name = "guitar-registry.ingestion.created-by",
            defaultValue = "guitar-registry-ingestion/1.0.0-SNAPSHOT")
    String createdBy;

    // ── Container resources ───────────────────────────────────

    @Inject
    DataSource dataSource;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public IngestionOptions ingestionOptions() {
        IngestionOptions options = IngestionOptions.builder()
                .updateThreshold(updateThreshold)
                .reviewThreshold(reviewThreshold)
                .manufacturerMatchThreshold(manufacturerMatchThreshold)
                .modelMatchThreshold(modelMatchThreshold)
                .guitarMatchThreshold(guitarMatchThreshold)
                .maxFailureRate(maxFailureRate)
                .maxBatchSize(maxBatchSize)
                .createdBy(createdBy)
                .build();
        log.info("Producing IngestionOptions: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public CatalogStore catalogStore() {
        return new JdbcCatalogStore(dataSource);
    }

    @Produces
    @ApplicationScoped
    public CatalogIngestor catalogIngestor(CatalogStore store, IngestionOptions options) {
        MetricsService metrics = meterRegistry.isResolvable()
                ? new MicrometerMetricsService(meterRegistry.get())
                : new NoOpMetricsService();
        TracingService tracing = tracer.isResolvable()
                ? new OpenTelemetryTracingService(tracer.get())
                : new NoOpTracingService();
        log.info("Producing CatalogIngestor: metrics={} tracing={}",
                metrics.getClass().getSimpleName(), tracing.getClass().getSimpleName());
        return CatalogIngestor.builder()
                .store(store)
                .options(options)
                .metricsService(metrics)
                .tracingService(tracing)
                .build();
    }

    public void closeIngestor(@Disposes CatalogIngestor ingestor) {
        log.info("Closing CatalogIngestor");
        ingestor.close();
    }

    @Produces
    @ApplicationScoped
    public ReviewService reviewService(CatalogIngestor ingestor) {
        return ingestor.getReviewService();
    }
}
