package com.guitar.registry.metrics;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsService} backed by a Micrometer {@link MeterRegistry}.
 *
 * <ul>
 *   <li>{@code catalog.submission.duration}: Timer (tag: outcome)</li>
 *   <li>{@code catalog.entity.inserted}, {@code catalog.entity.updated},
 *       {@code catalog.entity.manual_review}: Counters (tag: entityKind)</li>
 *   <li>{@code catalog.submission.failed}: Counter (tag: failureKind)</li>
 *   <li>{@code catalog.match.score}: DistributionSummary (tag: entityKind)</li>
 *   <li>{@code catalog.batch.size}: DistributionSummary</li>
 *   <li>{@code catalog.batch.rolled_back}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<EntityKind, DistributionSummary> matchScores = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final Counter rollbackCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("catalog.batch.size")
                .description("Submissions per ingestion call")
                .register(registry);
        this.rollbackCounter = Counter.builder("catalog.batch.rolled_back")
                .description("Ingestion calls whose transaction was rolled back")
                .register(registry);
    }

    @Override
    public void recordSubmissionDuration(String outcome, Duration duration) {
        timers.computeIfAbsent(outcome, o ->
                Timer.builder("catalog.submission.duration")
                        .description("Time spent resolving and writing one submission")
                        .tag("outcome", o)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementInserted(EntityKind kind) {
        entityCounter("catalog.entity.inserted", "Rows inserted", kind).increment();
    }

    @Override
    public void incrementUpdated(EntityKind kind) {
        entityCounter("catalog.entity.updated", "Rows merged into", kind).increment();
    }

    @Override
    public void incrementManualReview(EntityKind kind) {
        entityCounter("catalog.entity.manual_review", "Submissions stopped for manual review", kind).increment();
    }

    @Override
    public void incrementFailure(FailureKind kind) {
        counters.computeIfAbsent("failed:" + kind.name(), k ->
                Counter.builder("catalog.submission.failed")
                        .description("Submissions that failed")
                        .tag("failureKind", kind.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordMatchScore(EntityKind kind, double score) {
        matchScores.computeIfAbsent(kind, k ->
                DistributionSummary.builder("catalog.match.score")
                        .description("Best candidate score per resolved entity")
                        .tag("entityKind", k.name())
                        .register(registry))
                .record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementRollback() {
        rollbackCounter.increment();
    }

    private Counter entityCounter(String name, String description, EntityKind kind) {
        return counters.computeIfAbsent(name + ":" + kind.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityKind", kind.name())
                        .register(registry));
    }
}
