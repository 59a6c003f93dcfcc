package com.dbbaskette.codeguardian.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ReviewTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 1, 15, 10, 0);

    private static Review newReview() {
        PullRequest pr = new PullRequest("acme", "shop", 5, "Title");
        pr.setId(11L);
        return new Review(pr, ReviewType.FULL_REVIEW, T0);
    }

    @Test
    void newReviewIsPendingAndHoldsSlot() {
        Review review = newReview();
        assertEquals(ReviewStatus.PENDING, review.getStatus());
        assertEquals(11L, review.getActivePullRequestId());
        assertEquals(T0, review.getCreatedAt());
    }

    @Test
    void happyPathTransitions() {
        Review review = newReview();
        review.transitionTo(ReviewStatus.IN_PROGRESS, T0.plusSeconds(1));
        assertEquals(T0.plusSeconds(1), review.getStartedAt());
        assertEquals(11L, review.getActivePullRequestId());

        review.transitionTo(ReviewStatus.COMPLETED, T0.plusSeconds(5));
        assertEquals(ReviewStatus.COMPLETED, review.getStatus());
        assertEquals(T0.plusSeconds(5), review.getCompletedAt());
        assertNull(review.getActivePullRequestId());
    }

    @Test
    void failFromPendingOrInProgress() {
        Review pending = newReview();
        pending.transitionTo(ReviewStatus.FAILED, T0);
        assertNull(pending.getActivePullRequestId());

        Review running = newReview();
        running.transitionTo(ReviewStatus.IN_PROGRESS, T0);
        running.transitionTo(ReviewStatus.FAILED, T0);
        assertEquals(ReviewStatus.FAILED, running.getStatus());
    }

    @Test
    void illegalTransitionsThrow() {
        Review review = newReview();
        assertThrows(IllegalStateException.class, () -> review.transitionTo(ReviewStatus.COMPLETED, T0));

        review.transitionTo(ReviewStatus.IN_PROGRESS, T0);
        review.transitionTo(ReviewStatus.COMPLETED, T0);
        for (ReviewStatus target : ReviewStatus.values()) {
            assertThrows(IllegalStateException.class, () -> review.transitionTo(target, T0));
        }
    }
}
