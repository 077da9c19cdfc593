package com.guitar.registry.batch;

import com.guitar.registry.api.BatchIngestionResult;
import com.guitar.registry.api.BatchSummary;
import com.guitar.registry.api.SubmissionResult;
import com.guitar.registry.audit.AuditAction;
import com.guitar.registry.audit.AuditService;
import com.guitar.registry.core.IngestionException;
import com.guitar.registry.core.model.FailureKind;
import com.guitar.registry.core.payload.Submission;
import com.guitar.registry.decision.ResolutionAction;
import com.guitar.registry.logging.LogContext;
import com.guitar.registry.metrics.MetricsService;
import com.guitar.registry.pipeline.ManualReviewRequiredException;
import com.guitar.registry.pipeline.ResolutionOverride;
import com.guitar.registry.pipeline.SubmissionContext;
import com.guitar.registry.pipeline.SubmissionPipeline;
import com.guitar.registry.review.ReviewItem;
import com.guitar.registry.review.ReviewQueue;
import com.guitar.registry.store.CatalogStore;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.tracing.Span;
import com.guitar.registry.tracing.TracingService;
import com.guitar.registry.validation.SchemaViolation;
import com.guitar.registry.validation.SchemaViolationException;
import com.guitar.registry.writer.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the submissions of one call in order, inside one catalog transaction.
 *
 * <p>Rows written by an earlier submission are visible to the matching of later ones. Each
 * submission runs under a savepoint, so a failed submission leaves no rows behind and the scan
 * continues. Once every submission has a result, {@link BatchCommitPolicy} decides whether the
 * transaction commits. Any exception that escapes per-submission handling (savepoints, commit,
 * the store itself) rolls the whole call back.</p>
 *
 * <p>Audit entries for writes, metrics for writes, and review items are published only once the
 * outcome of the transaction is known: writes only after a commit, review items unless the whole
 * batch was discarded.</p>
 */
public class BatchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";
    private static final String OUTCOME_MANUAL_REVIEW = "manual_review";

    private final CatalogStore store;
    private final SubmissionPipeline pipeline;
    private final BatchCommitPolicy commitPolicy;
    private final int maxBatchSize;
    private final String actorId;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final AuditService audit;
    private final ReviewQueue reviewQueue;
    private final Clock clock;

    public BatchCoordinator(CatalogStore store, SubmissionPipeline pipeline, BatchCommitPolicy commitPolicy,
                            int maxBatchSize, String actorId, MetricsService metrics, TracingService tracing,
                            AuditService audit, ReviewQueue reviewQueue, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
        this.commitPolicy = commitPolicy;
        this.maxBatchSize = maxBatchSize;
        this.actorId = actorId;
        this.metrics = metrics;
        this.tracing = tracing;
        this.audit = audit;
        this.reviewQueue = reviewQueue;
        this.clock = clock;
    }

    /**
     * @param submissions raw submissions, each expected to be a {@code Map} of sections
     * @param batchMode   {@code false} for a single-submission call, which never reports a batch rollback
     * @param overrides   reviewer rulings applied to every submission of the call
     * @throws IllegalArgumentException if there are more submissions than the configured maximum
     */
    public BatchIngestionResult process(List<?> submissions, boolean batchMode, List<ResolutionOverride> overrides) {
        Objects.requireNonNull(submissions, "submissions must not be null");
        if (submissions.size() > maxBatchSize) {
            throw new IllegalArgumentException("Batch of " + submissions.size()
                    + " submissions exceeds the maximum of " + maxBatchSize);
        }
        int total = submissions.size();
        metrics.recordBatchSize(total);
        if (total == 0) {
            return new BatchIngestionResult(true, 0, 0, List.of(), BatchSummary.from(List.of()),
                    false, null, false, null);
        }

        String batchId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forBatch(batchId, total);
             Span span = tracing.startSpan(TracingService.BATCH_SPAN,
                     Map.of("batchId", batchId, "batchMode", Boolean.toString(batchMode)))) {
            span.setAttribute("batchSize", total);

            List<SubmissionResult> results = new ArrayList<>(total);
            List<ReviewItem> reviewRequests = new ArrayList<>();
            CommitDecision decision;
            try {
                decision = runInTransaction(submissions, batchMode, overrides, batchId, results, reviewRequests);
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                metrics.incrementRollback();
                String error = "Batch processing error: " + e.getMessage();
                log.error("batch.failed batchId={} processed={} total={}", batchId, results.size(), total, e);
                audit.record(AuditAction.BATCH_ROLLED_BACK, null, null, actorId, batchId,
                        Map.of("reason", error, "totalCount", total));
                return new BatchIngestionResult(false, results.size(), total, results, BatchSummary.from(results),
                        true, null, false, error);
            }

            BatchSummary summary = BatchSummary.from(results);
            publish(batchId, decision, results, reviewRequests, summary);
            span.setAttribute("failed", summary.failed());
            span.setStatus(decision.commit() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            return new BatchIngestionResult(summary.failed() == 0 && decision.commit(), results.size(), total,
                    results, summary, decision.reportedRollback(), decision.rollbackReason(),
                    decision.partialSuccess(), null);
        }
    }

    private CommitDecision runInTransaction(List<?> submissions, boolean batchMode,
                                            List<ResolutionOverride> overrides, String batchId,
                                            List<SubmissionResult> results, List<ReviewItem> reviewRequests) {
        try (CatalogTransaction tx = store.begin()) {
            for (int index = 0; index < submissions.size(); index++) {
                Object raw = submissions.get(index);
                SubmissionResult result = processSubmission(tx, index, raw, batchId, overrides);
                results.add(result);
                if (result.manualReviewNeeded()) {
                    reviewRequests.add(reviewItem(result, raw, batchId, overrides));
                }
            }

            int failed = (int) results.stream().filter(r -> !r.success()).count();
            CommitDecision decision = commitPolicy.decide(batchMode, failed, results.size());
            if (decision.commit()) {
                tx.commit();
                log.info("batch.committed batchId={} total={} failed={} partialSuccess={}",
                        batchId, results.size(), failed, decision.partialSuccess());
            } else {
                tx.rollback();
                if (decision.reportedRollback()) {
                    log.warn("batch.rolledBack batchId={} reason={}", batchId, decision.rollbackReason());
                } else {
                    log.info("submission.rolledBack batchId={} failed={}", batchId, failed);
                }
            }
            return decision;
        }
    }

    private SubmissionResult processSubmission(CatalogTransaction tx, int index, Object raw, String batchId,
                                               List<ResolutionOverride> overrides) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forSubmission(batchId, index);
             Span span = tracing.startSpan(TracingService.SUBMISSION_SPAN,
                     Map.of("batchId", batchId, "submissionIndex", Integer.toString(index)))) {
            SubmissionResult result = resolveSubmission(tx, index, raw, batchId, overrides);
            span.setStatus(result.success() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            if (result.failureKind() != null) {
                span.setAttribute("failureKind", result.failureKind().name());
            }
            metrics.recordSubmissionDuration(outcome(result), Duration.ofNanos(System.nanoTime() - start));
            return result;
        }
    }

    private SubmissionResult resolveSubmission(CatalogTransaction tx, int index, Object raw, String batchId,
                                               List<ResolutionOverride> overrides) {
        Submission submission;
        try {
            submission = pipeline.parse(raw);
        } catch (SchemaViolationException e) {
            log.info("submission.rejected index={} violations={}", index, e.getViolations().size());
            List<String> conflicts = e.getViolations().stream().map(SchemaViolation::toString).toList();
            return SubmissionResult.failed(index, FailureKind.SCHEMA_VIOLATION, conflicts, e.getMessage());
        }

        String savepoint = tx.setSavepoint();
        List<WriteOutcome> writes;
        try {
            writes = pipeline.apply(tx, new SubmissionContext(index, batchId, submission, overrides));
        } catch (ManualReviewRequiredException e) {
            undo(tx, savepoint);
            log.info("submission.needsReview index={} kind={} candidate={} score={}",
                    index, e.getEntityKind(), e.getCandidate().entityId(), e.getCandidate().score());
            return SubmissionResult.needsReview(index, e.getEntityKind(), e.getCandidate(), e.getMessage());
        } catch (IngestionException e) {
            undo(tx, savepoint);
            log.info("submission.failed index={} kind={} error={}", index, e.kind(), e.getMessage());
            return SubmissionResult.failed(index, e.kind(), List.of(e.getMessage()), e.getMessage());
        } catch (RuntimeException e) {
            undo(tx, savepoint);
            String message = "Processing error: " + e.getMessage();
            log.warn("submission.error index={} error={}", index, e.getMessage(), e);
            return SubmissionResult.failed(index, FailureKind.PROCESSING_ERROR, List.of(message), message);
        }
        tx.releaseSavepoint(savepoint);

        SubmissionResult result = SubmissionResult.succeeded(index, writes);
        log.debug("submission.succeeded index={} actions={}", index, result.actionsTaken());
        return result;
    }

    private static void undo(CatalogTransaction tx, String savepoint) {
        tx.rollbackToSavepoint(savepoint);
        tx.releaseSavepoint(savepoint);
    }

    private ReviewItem reviewItem(SubmissionResult result, Object raw, String batchId,
                                  List<ResolutionOverride> overrides) {
        Map<String, Object> submission = new LinkedHashMap<>();
        ((Map<?, ?>) raw).forEach((key, value) -> submission.put(String.valueOf(key), value));
        return ReviewItem.builder()
                .entityKind(result.reviewKind())
                .candidateEntityId(result.reviewCandidate().entityId())
                .candidateLabel(result.reviewCandidate().label())
                .similarityScore(result.reviewCandidate().score())
                .conflict(result.error())
                .submissionIndex(result.index())
                .batchId(batchId)
                .submission(submission)
                .overrides(overrides)
                .submittedAt(clock.instant())
                .build();
    }

    private void publish(String batchId, CommitDecision decision, List<SubmissionResult> results,
                         List<ReviewItem> reviewRequests, BatchSummary summary) {
        for (SubmissionResult result : results) {
            if (result.failureKind() != null) {
                metrics.incrementFailure(result.failureKind());
            }
        }

        if (decision.commit()) {
            for (SubmissionResult result : results) {
                for (WriteOutcome write : result.writes()) {
                    if (write.action() == ResolutionAction.INSERT) {
                        metrics.incrementInserted(write.kind());
                    } else {
                        metrics.incrementUpdated(write.kind());
                    }
                    audit.recordWrite(write, actorId, batchId);
                }
            }
            audit.record(AuditAction.BATCH_COMMITTED, null, null, actorId, batchId, Map.of(
                    "totalCount", results.size(),
                    "successful", summary.successful(),
                    "failed", summary.failed(),
                    "partialSuccess", decision.partialSuccess()));
        } else if (decision.reportedRollback()) {
            metrics.incrementRollback();
            audit.record(AuditAction.BATCH_ROLLED_BACK, null, null, actorId, batchId, Map.of(
                    "reason", decision.rollbackReason(),
                    "totalCount", results.size()));
        }

        if (decision.reportedRollback()) {
            return;
        }
        for (ReviewItem item : reviewRequests) {
            reviewQueue.submit(item);
            metrics.incrementManualReview(item.getEntityKind());
            audit.record(AuditAction.MANUAL_REVIEW_REQUESTED, item.getEntityKind(), item.getId(), actorId, batchId,
                    Map.of("candidateEntityId", item.getCandidateEntityId().toString(),
                            "similarityScore", item.getSimilarityScore()));
            log.info("review.submitted reviewItemId={} kind={} candidateEntityId={} score={}",
                    item.getId(), item.getEntityKind(), item.getCandidateEntityId(), item.getSimilarityScore());
        }
    }

    private static String outcome(SubmissionResult result) {
        if (result.success()) {
            return OUTCOME_SUCCESS;
        }
        return result.manualReviewNeeded() ? OUTCOME_MANUAL_REVIEW : OUTCOME_FAILURE;
    }
}
