package com.guitar.registry.review;

import com.guitar.registry.api.Page;
import com.guitar.registry.api.PageRequest;
import com.guitar.registry.core.model.EntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryReviewQueueTest {

    private static final Instant SUBMITTED = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryReviewQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryReviewQueue();
    }

    private ReviewItem createReviewItem(EntityKind kind, int index, Instant submittedAt) {
        return ReviewItem.builder()
                .entityKind(kind)
                .candidateEntityId(UUID.randomUUID())
                .candidateLabel("Gibson Guitar Corporation")
                .similarityScore(0.9)
                .conflict("Manufacturer conflict: Similar manufacturer found: Gibson Guitar Corporation")
                .submissionIndex(index)
                .batchId("batch-1")
                .submission(Map.of("manufacturer", Map.of("name", "Gibson Guitar Corp")))
                .submittedAt(submittedAt)
                .build();
    }

    private ReviewItem createReviewItem(int index) {
        return createReviewItem(EntityKind.MANUFACTURER, index, SUBMITTED);
    }

    @Test
    @DisplayName("Should submit review item as pending")
    void testSubmit() {
        ReviewItem item = createReviewItem(0);
        ReviewItem submitted = queue.submit(item);

        assertNotNull(submitted.getId());
        assertEquals(ReviewStatus.PENDING, submitted.getStatus());
        assertSame(item, queue.get(item.getId()));
        assertEquals(1, queue.countPending());
    }

    @Test
    @DisplayName("Should get pending items with pagination in submission order")
    void testGetPending() {
        for (int i = 4; i >= 0; i--) {
            queue.submit(createReviewItem(i));
        }

        Page<ReviewItem> page = queue.getPending(PageRequest.of(0, 3));
        assertEquals(3, page.numberOfElements());
        assertEquals(5, page.totalElements());
        assertTrue(page.hasNext());
        assertEquals(0, page.content().get(0).getSubmissionIndex());
        assertEquals(2, page.content().get(2).getSubmissionIndex());

        Page<ReviewItem> page2 = queue.getPending(PageRequest.of(1, 3));
        assertEquals(2, page2.numberOfElements());
        assertFalse(page2.hasNext());
    }

    @Test
    @DisplayName("Should order by submission time before index")
    void testOrderByTime() {
        ReviewItem later = queue.submit(createReviewItem(EntityKind.MODEL, 0, SUBMITTED.plusSeconds(60)));
        ReviewItem earlier = queue.submit(createReviewItem(EntityKind.MODEL, 7, SUBMITTED));

        Page<ReviewItem> page = queue.getPending(PageRequest.first(10));

        assertEquals(earlier.getId(), page.content().get(0).getId());
        assertEquals(later.getId(), page.content().get(1).getId());
    }

    @Test
    @DisplayName("Should filter by entity kind")
    void testFilterByEntityKind() {
        queue.submit(createReviewItem(EntityKind.MANUFACTURER, 0, SUBMITTED));
        queue.submit(createReviewItem(EntityKind.MODEL, 1, SUBMITTED));
        queue.submit(createReviewItem(EntityKind.MANUFACTURER, 2, SUBMITTED));

        assertEquals(2, queue.getPendingByEntityKind(EntityKind.MANUFACTURER, PageRequest.first(10)).totalElements());
        assertEquals(1, queue.getPendingByEntityKind(EntityKind.MODEL, PageRequest.first(10)).totalElements());
        assertEquals(0, queue.getPendingByEntityKind(EntityKind.INDIVIDUAL_GUITAR, PageRequest.first(10))
                .totalElements());
    }

    @Test
    @DisplayName("Should approve review item")
    void testApprove() {
        ReviewItem item = queue.submit(createReviewItem(0));
        Instant reviewedAt = SUBMITTED.plusSeconds(3600);

        queue.approve(item.getId(), "reviewer-1", "Same company", reviewedAt);

        ReviewItem approved = queue.get(item.getId());
        assertEquals(ReviewStatus.APPROVED, approved.getStatus());
        assertEquals("reviewer-1", approved.getReviewerId());
        assertEquals("Same company", approved.getNotes());
        assertEquals(reviewedAt, approved.getReviewedAt());
        assertEquals(0, queue.countPending());
        assertEquals(0, queue.getPending(PageRequest.first(10)).totalElements());
    }

    @Test
    @DisplayName("Should reject review item")
    void testReject() {
        ReviewItem item = queue.submit(createReviewItem(0));

        queue.reject(item.getId(), "reviewer-1", null, SUBMITTED);

        assertEquals(ReviewStatus.REJECTED, queue.get(item.getId()).getStatus());
    }

    @Test
    @DisplayName("Should not resolve an item twice")
    void testResolveTwice() {
        ReviewItem item = queue.submit(createReviewItem(0));
        queue.approve(item.getId(), "reviewer-1", null, SUBMITTED);

        assertThrows(IllegalStateException.class,
                () -> queue.reject(item.getId(), "reviewer-2", null, SUBMITTED));
    }

    @Test
    @DisplayName("Should fail for unknown id")
    void testUnknownId() {
        assertNull(queue.get("missing"));
        assertThrows(IllegalArgumentException.class,
                () -> queue.approve("missing", "reviewer-1", null, SUBMITTED));
    }
}
