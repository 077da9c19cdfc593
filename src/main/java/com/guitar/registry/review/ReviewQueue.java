package com.guitar.registry.review;

import com.guitar.registry.api.Page;
import com.guitar.registry.api.PageRequest;
import com.guitar.registry.core.model.EntityKind;

import java.time.Instant;

/**
 * Holds submissions waiting for a reviewer.
 */
public interface ReviewQueue {

    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    Page<ReviewItem> getPendingByEntityKind(EntityKind kind, PageRequest page);

    /**
     * @throws IllegalArgumentException if no item has this id
     * @throws IllegalStateException    if the item is no longer pending
     */
    void approve(String reviewId, String reviewerId, String notes, Instant reviewedAt);

    /**
     * @throws IllegalArgumentException if no item has this id
     * @throws IllegalStateException    if the item is no longer pending
     */
    void reject(String reviewId, String reviewerId, String notes, Instant reviewedAt);

    /**
     * @return the item, or {@code null} if not found
     */
    ReviewItem get(String reviewId);

    long countPending();
}
