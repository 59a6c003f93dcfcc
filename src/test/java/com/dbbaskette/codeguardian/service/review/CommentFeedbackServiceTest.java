package com.dbbaskette.codeguardian.service.review;

import com.dbbaskette.codeguardian.model.CommentFeedback;
import com.dbbaskette.codeguardian.model.PullRequest;
import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewCategory;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.model.ReviewType;
import com.dbbaskette.codeguardian.model.Severity;
import com.dbbaskette.codeguardian.service.result.ErrorKind;
import com.dbbaskette.codeguardian.service.result.OperationResult;
import com.dbbaskette.codeguardian.service.store.InMemoryReviewStore;
import com.dbbaskette.codeguardian.service.store.ReviewOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommentFeedbackServiceTest {

    private static final LocalDateTime CREATED = LocalDateTime.of(2026, 1, 15, 9, 0);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private InMemoryReviewStore store;
    private CommentFeedbackService service;
    private Long commentId;

    @BeforeEach
    void setUp() {
        store = new InMemoryReviewStore();
        service = new CommentFeedbackService(store, CLOCK);

        PullRequest pr = store.addPullRequest("acme", "shop", 3, "Feedback");
        Review review = store.openReview(pr, ReviewType.FULL_REVIEW, CREATED).orElseThrow();
        ReviewComment comment = new ReviewComment(review.getId(), 0, CREATED);
        comment.setSeverity(Severity.MEDIUM);
        comment.setCategory(ReviewCategory.STYLE);
        comment.setTitle("Naming");
        comment.setMessage("Rename x");
        store.completeReview(review.getId(), new ReviewOutcome(80, 80, 80, 80, "ok", List.of(), "m", 1,
                BigDecimal.ZERO, 1), List.of(comment), CREATED);
        commentId = store.findComments(review.getId()).get(0).getId();
    }

    @Test
    void recordFeedback_helpfulDoesNotResolve() {
        ReviewComment updated = service.recordFeedback(commentId, "helpful").orElseThrow();

        assertEquals(CommentFeedback.HELPFUL, updated.getUserFeedback());
        assertFalse(updated.isResolved());
        assertNull(updated.getResolvedAt());
    }

    @Test
    void recordFeedback_appliedResolvesComment() {
        ReviewComment updated = service.recordFeedback(commentId, "APPLIED").orElseThrow();

        assertEquals(CommentFeedback.APPLIED, updated.getUserFeedback());
        assertTrue(updated.isResolved());
        assertEquals(LocalDateTime.of(2026, 1, 15, 10, 0), updated.getResolvedAt());
        assertEquals("Rename x", updated.getMessage());
    }

    @Test
    void recordFeedback_laterFeedbackKeepsResolution() {
        service.recordFeedback(commentId, "applied");
        ReviewComment updated = service.recordFeedback(commentId, "not_helpful").orElseThrow();

        assertEquals(CommentFeedback.NOT_HELPFUL, updated.getUserFeedback());
        assertTrue(updated.isResolved());
    }

    @Test
    void recordFeedback_rejectsUnknownValue() {
        OperationResult<ReviewComment> result = service.recordFeedback(commentId, "meh");

        assertEquals(ErrorKind.VALIDATION, result.errorKind());
        assertEquals("feedback", result.error().details().get("field"));
        assertNull(store.findCommentById(commentId).orElseThrow().getUserFeedback());
    }

    @Test
    void recordFeedback_unknownCommentIsNotFound() {
        assertEquals(ErrorKind.NOT_FOUND, service.recordFeedback(999L, "helpful").errorKind());
    }
}
