package com.guitar.registry.review;

import com.guitar.registry.api.Page;
import com.guitar.registry.api.PageRequest;
import com.guitar.registry.api.SubmissionResult;
import com.guitar.registry.audit.AuditAction;
import com.guitar.registry.audit.AuditService;
import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.logging.LogContext;
import com.guitar.registry.pipeline.ResolutionOverride;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves manual-review items by replaying their submission with the reviewer's ruling.
 *
 * <p>Approving merges the held-back entity into the candidate row; rejecting inserts it as a new
 * row. The item is closed when the replay succeeds, or when the replay stops at a further review
 * (which raises its own item carrying this ruling). Any other replay failure leaves the item
 * pending so it can be retried.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final AuditService auditService;
    private final SubmissionReplayer replayer;
    private final Clock clock;

    public ReviewService(ReviewQueue reviewQueue, AuditService auditService, SubmissionReplayer replayer, Clock clock) {
        this.reviewQueue = reviewQueue;
        this.auditService = auditService;
        this.replayer = replayer;
        this.clock = clock;
    }

    public SubmissionResult approve(String reviewId, String reviewerId, String notes) {
        ReviewItem item = requirePending(reviewId);
        return resolve(item, ResolutionOverride.mergeInto(item.getEntityKind(), item.getCandidateEntityId()),
                ReviewStatus.APPROVED, reviewerId, notes);
    }

    public SubmissionResult reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = requirePending(reviewId);
        return resolve(item, ResolutionOverride.insertNew(item.getEntityKind()),
                ReviewStatus.REJECTED, reviewerId, notes);
    }

    private SubmissionResult resolve(ReviewItem item, ResolutionOverride ruling, ReviewStatus outcome,
                                     String reviewerId, String notes) {
        try (LogContext ctx = LogContext.forReview(item.getId())) {
            List<ResolutionOverride> overrides = new ArrayList<>(item.getOverrides());
            overrides.removeIf(o -> o.kind() == ruling.kind());
            overrides.add(ruling);

            SubmissionResult result = replayer.replay(item.getSubmission(), overrides);
            if (!result.success() && !result.manualReviewNeeded()) {
                log.warn("review.replayFailed reviewItemId={} failureKind={} error={}",
                        item.getId(), result.failureKind(), result.error());
                return result;
            }

            if (outcome == ReviewStatus.APPROVED) {
                reviewQueue.approve(item.getId(), reviewerId, notes, clock.instant());
            } else {
                reviewQueue.reject(item.getId(), reviewerId, notes, clock.instant());
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("decision", outcome.name());
            details.put("candidateEntityId", item.getCandidateEntityId().toString());
            details.put("replaySucceeded", result.success());
            if (notes != null) {
                details.put("notes", notes);
            }
            auditService.record(AuditAction.MANUAL_REVIEW_COMPLETED, item.getEntityKind(), item.getId(),
                    reviewerId, item.getBatchId(), details);
            log.info("review.{} reviewItemId={} kind={} replaySucceeded={}",
                    outcome == ReviewStatus.APPROVED ? "approved" : "rejected",
                    item.getId(), item.getEntityKind(), result.success());
            return result;
        }
    }

    private ReviewItem requirePending(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }

    public Page<ReviewItem> getPendingReviews(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    public Page<ReviewItem> getPendingReviews(EntityKind kind, PageRequest page) {
        return reviewQueue.getPendingByEntityKind(kind, page);
    }

    public ReviewItem getReviewItem(String reviewId) {
        return reviewQueue.get(reviewId);
    }

    public long getPendingCount() {
        return reviewQueue.countPending();
    }
}
