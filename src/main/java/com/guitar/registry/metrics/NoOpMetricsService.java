package com.guitar.registry.metrics;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.FailureKind;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSubmissionDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementInserted(EntityKind kind) {
    }

    @Override
    public void incrementUpdated(EntityKind kind) {
    }

    @Override
    public void incrementManualReview(EntityKind kind) {
    }

    @Override
    public void incrementFailure(FailureKind kind) {
    }

    @Override
    public void recordMatchScore(EntityKind kind, double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementRollback() {
    }
}
