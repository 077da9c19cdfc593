package com.guitar.registry.api;

/**
 * Tuning knobs for an ingestion engine: resolution thresholds, candidate cut-offs,
 * the batch failure tolerance and the creator stamp written on new rows.
 */
public class IngestionOptions {

    private static final double DEFAULT_UPDATE_THRESHOLD = 0.95;
    private static final double DEFAULT_REVIEW_THRESHOLD = 0.85;
    private static final double DEFAULT_MANUFACTURER_MATCH_THRESHOLD = 0.7;
    private static final double DEFAULT_MODEL_MATCH_THRESHOLD = 0.8;
    private static final double DEFAULT_GUITAR_MATCH_THRESHOLD = 0.5;
    private static final double DEFAULT_MAX_FAILURE_RATE = 0.5;
    private static final int DEFAULT_MAX_BATCH_SIZE = 10_000;
    private static final String DEFAULT_CREATED_BY = "guitar-registry-ingestion/1.0.0-SNAPSHOT";

    private final double updateThreshold;
    private final double reviewThreshold;
    private final double manufacturerMatchThreshold;
    private final double modelMatchThreshold;
    private final double guitarMatchThreshold;
    private final double maxFailureRate;
    private final int maxBatchSize;
    private final String createdBy;

    private IngestionOptions(Builder builder) {
        this.updateThreshold = builder.updateThreshold;
        this.reviewThreshold = builder.reviewThreshold;
        this.manufacturerMatchThreshold = builder.manufacturerMatchThreshold;
        this.modelMatchThreshold = builder.modelMatchThreshold;
        this.guitarMatchThreshold = builder.guitarMatchThreshold;
        this.maxFailureRate = builder.maxFailureRate;
        this.maxBatchSize = builder.maxBatchSize;
        this.createdBy = builder.createdBy;
    }

    /** Score at or above which a manufacturer or model candidate is merged into. */
    public double getUpdateThreshold() {
        return updateThreshold;
    }

    /** Score at or above which (and below the update threshold) a submission waits for a reviewer. */
    public double getReviewThreshold() {
        return reviewThreshold;
    }

    public double getManufacturerMatchThreshold() {
        return manufacturerMatchThreshold;
    }

    public double getModelMatchThreshold() {
        return modelMatchThreshold;
    }

    public double getGuitarMatchThreshold() {
        return guitarMatchThreshold;
    }

    /** Failure rate above which a whole batch is rolled back. */
    public double getMaxFailureRate() {
        return maxFailureRate;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Builder toBuilder() {
        return new Builder()
                .updateThreshold(updateThreshold)
                .reviewThreshold(reviewThreshold)
                .manufacturerMatchThreshold(manufacturerMatchThreshold)
                .modelMatchThreshold(modelMatchThreshold)
                .guitarMatchThreshold(guitarMatchThreshold)
                .maxFailureRate(maxFailureRate)
                .maxBatchSize(maxBatchSize)
                .createdBy(createdBy);
    }

    public static IngestionOptions defaults() {
        return builder().build();
    }

    /**
     * Stricter options: merges need a near-exact name and more candidates go to review.
     */
    public static IngestionOptions conservative() {
        return builder()
                .updateThreshold(0.98)
                .reviewThreshold(0.80)
                .maxFailureRate(0.25)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double updateThreshold = DEFAULT_UPDATE_THRESHOLD;
        private double reviewThreshold = DEFAULT_REVIEW_THRESHOLD;
        private double manufacturerMatchThreshold = DEFAULT_MANUFACTURER_MATCH_THRESHOLD;
        private double modelMatchThreshold = DEFAULT_MODEL_MATCH_THRESHOLD;
        private double guitarMatchThreshold = DEFAULT_GUITAR_MATCH_THRESHOLD;
        private double maxFailureRate = DEFAULT_MAX_FAILURE_RATE;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private String createdBy = DEFAULT_CREATED_BY;

        public Builder updateThreshold(double updateThreshold) {
            validateThreshold(updateThreshold, "updateThreshold");
            this.updateThreshold = updateThreshold;
            return this;
        }

        public Builder reviewThreshold(double reviewThreshold) {
            validateThreshold(reviewThreshold, "reviewThreshold");
            this.reviewThreshold = reviewThreshold;
            return this;
        }

        public Builder manufacturerMatchThreshold(double manufacturerMatchThreshold) {
            validateThreshold(manufacturerMatchThreshold, "manufacturerMatchThreshold");
            this.manufacturerMatchThreshold = manufacturerMatchThreshold;
            return this;
        }

        public Builder modelMatchThreshold(double modelMatchThreshold) {
            validateThreshold(modelMatchThreshold, "modelMatchThreshold");
            this.modelMatchThreshold = modelMatchThreshold;
            return this;
        }

        public Builder guitarMatchThreshold(double guitarMatchThreshold) {
            validateThreshold(guitarMatchThreshold, "guitarMatchThreshold");
            this.guitarMatchThreshold = guitarMatchThreshold;
            return this;
        }

        public Builder maxFailureRate(double maxFailureRate) {
            validateThreshold(maxFailureRate, "maxFailureRate");
            this.maxFailureRate = maxFailureRate;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) {
                throw new IllegalArgumentException("maxBatchSize must be positive");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder createdBy(String createdBy) {
            if (createdBy == null || createdBy.isBlank()) {
                throw new IllegalArgumentException("createdBy must not be blank");
            }
            this.createdBy = createdBy;
            return this;
        }

        public IngestionOptions build() {
            if (updateThreshold < reviewThreshold) {
                throw new IllegalArgumentException("updateThreshold must be >= reviewThreshold");
            }
            return new IngestionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "IngestionOptions{" +
                "updateThreshold=" + updateThreshold +
                ", reviewThreshold=" + reviewThreshold +
                ", manufacturerMatchThreshold=" + manufacturerMatchThreshold +
                ", modelMatchThreshold=" + modelMatchThreshold +
                ", guitarMatchThreshold=" + guitarMatchThreshold +
                ", maxFailureRate=" + maxFailureRate +
                ", maxBatchSize=" + maxBatchSize +
                ", createdBy='" + createdBy + '\'' +
                '}';
    }
}
