package com.guitar.registry.review;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.pipeline.ResolutionOverride;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A submission held back because one of its entities scored in the review band against an
 * existing row. Keeps the raw submission so it can be replayed once a reviewer decides.
 *
 * <p>{@code overrides} are the reviewer rulings already in force when the item was raised;
 * a later replay carries them forward.</p>
 */
public class ReviewItem {

    private final String id;
    private final EntityKind entityKind;
    private final UUID candidateEntityId;
    private final String candidateLabel;
    private final double similarityScore;
    private final String conflict;
    private final int submissionIndex;
    private final String batchId;
    private final Map<String, Object> submission;
    private final List<ResolutionOverride> overrides;
    private final Instant submittedAt;
    private ReviewStatus status;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.entityKind = Objects.requireNonNull(builder.entityKind, "entityKind is required");
        this.candidateEntityId = Objects.requireNonNull(builder.candidateEntityId, "candidateEntityId is required");
        this.candidateLabel = builder.candidateLabel;
        this.similarityScore = builder.similarityScore;
        this.conflict = builder.conflict;
        this.submissionIndex = builder.submissionIndex;
        this.batchId = builder.batchId;
        this.submission = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(builder.submission, "submission is required")));
        this.overrides = builder.overrides != null ? List.copyOf(builder.overrides) : List.of();
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ReviewStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public UUID getCandidateEntityId() {
        return candidateEntityId;
    }

    public String getCandidateLabel() {
        return candidateLabel;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    public String getConflict() {
        return conflict;
    }

    public int getSubmissionIndex() {
        return submissionIndex;
    }

    public String getBatchId() {
        return batchId;
    }

    public Map<String, Object> getSubmission() {
        return submission;
    }

    public List<ResolutionOverride> getOverrides() {
        return overrides;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized ReviewStatus getStatus() {
        return status;
    }

    public synchronized Instant getReviewedAt() {
        return reviewedAt;
    }

    public synchronized String getReviewerId() {
        return reviewerId;
    }

    public synchronized String getNotes() {
        return notes;
    }

    public synchronized boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void resolve(ReviewStatus outcome, String reviewerId, String notes, Instant reviewedAt) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.status = outcome;
        this.reviewerId = reviewerId;
        this.notes = notes;
        this.reviewedAt = reviewedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", entityKind=" + entityKind +
                ", candidate=" + candidateLabel +
                ", score=" + similarityScore +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityKind entityKind;
        private UUID candidateEntityId;
        private String candidateLabel;
        private double similarityScore;
        private String conflict;
        private int submissionIndex;
        private String batchId;
        private Map<String, Object> submission;
        private List<ResolutionOverride> overrides;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityKind(EntityKind entityKind) {
            this.entityKind = entityKind;
            return this;
        }

        public Builder candidateEntityId(UUID candidateEntityId) {
            this.candidateEntityId = candidateEntityId;
            return this;
        }

        public Builder candidateLabel(String candidateLabel) {
            this.candidateLabel = candidateLabel;
            return this;
        }

        public Builder similarityScore(double similarityScore) {
            this.similarityScore = similarityScore;
            return this;
        }

        public Builder conflict(String conflict) {
            this.conflict = conflict;
            return this;
        }

        public Builder submissionIndex(int submissionIndex) {
            this.submissionIndex = submissionIndex;
            return this;
        }

        public Builder batchId(String batchId) {
            this.batchId = batchId;
            return this;
        }

        public Builder submission(Map<String, Object> submission) {
            this.submission = submission;
            return this;
        }

        public Builder overrides(List<ResolutionOverride> overrides) {
            this.overrides = overrides;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
