package com.guitar.registry.metrics;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.FailureKind;

import java.time.Duration;

/**
 * Ingestion metrics. {@link NoOpMetricsService} is the default, so the engine runs without a
 * metrics backend; {@link MicrometerMetricsService} records into a Micrometer registry.
 */
public interface MetricsService {

    /**
     * @param outcome {@code success}, {@code failure} or {@code manual_review}
     */
    void recordSubmissionDuration(String outcome, Duration duration);

    void incrementInserted(EntityKind kind);

    void incrementUpdated(EntityKind kind);

    void incrementManualReview(EntityKind kind);

    void incrementFailure(FailureKind kind);

    void recordMatchScore(EntityKind kind, double score);

    void recordBatchSize(int size);

    void incrementRollback();
}
