package com.guitar.registry.review;

import com.guitar.registry.api.Page;
import com.guitar.registry.api.PageRequest;
import com.guitar.registry.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * {@link ReviewQueue} kept in a concurrent map. Items live as long as the JVM.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("review.queued reviewItemId={} kind={} candidate={} score={}",
                item.getId(), item.getEntityKind(), item.getCandidateEntityId(), item.getSimilarityScore());
        return item;
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        return paginate(pending(item -> true), page);
    }

    @Override
    public Page<ReviewItem> getPendingByEntityKind(EntityKind kind, PageRequest page) {
        return paginate(pending(item -> item.getEntityKind() == kind), page);
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes, Instant reviewedAt) {
        require(reviewId).resolve(ReviewStatus.APPROVED, reviewerId, notes, reviewedAt);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes, Instant reviewedAt) {
        require(reviewId).resolve(ReviewStatus.REJECTED, reviewerId, notes, reviewedAt);
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem require(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }

    private List<ReviewItem> pending(Predicate<ReviewItem> filter) {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(filter)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getSubmissionIndex))
                .toList();
    }

    private Page<ReviewItem> paginate(List<ReviewItem> all, PageRequest page) {
        int total = all.size();
        int fromIndex = Math.min(page.offset(), total);
        int toIndex = Math.min(page.offset() + page.limit(), total);
        return new Page<>(all.subList(fromIndex, toIndex), total, page.pageNumber(), page.limit());
    }
}
