package com.dbbaskette.codeguardian.service.review;

import com.dbbaskette.codeguardian.model.PullRequest;
import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewCategory;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.model.ReviewStatus;
import com.dbbaskette.codeguardian.model.ReviewType;
import com.dbbaskette.codeguardian.model.Severity;
import com.dbbaskette.codeguardian.service.result.ErrorKind;
import com.dbbaskette.codeguardian.service.store.InMemoryReviewStore;
import com.dbbaskette.codeguardian.service.store.ReviewOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReviewQueryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 15, 10, 0);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private InMemoryReviewStore store;
    private ReviewQueryService service;
    private PullRequest prA;
    private PullRequest prB;

    @BeforeEach
    void setUp() {
        store = new InMemoryReviewStore();
        service = new ReviewQueryService(store, CLOCK);
        prA = store.addPullRequest("acme", "shop", 1, "A");
        prB = store.addPullRequest("acme", "shop", 2, "B");
    }

    private Review completed(PullRequest pr, LocalDateTime at, double overall, Severity... severities) {
        Review review = store.openReview(pr, ReviewType.FULL_REVIEW, at).orElseThrow();
        List<ReviewComment> comments = new ArrayList<>();
        for (int i = 0; i < severities.length; i++) {
            ReviewComment comment = new ReviewComment(review.getId(), i, at);
            comment.setSeverity(severities[i]);
            comment.setCategory(ReviewCategory.GENERAL);
            comment.setTitle("t");
            comment.setMessage("m");
            comments.add(comment);
        }
        store.completeReview(review.getId(), new ReviewOutcome(overall, 90, 80, 70, "ok", List.of(),
                "model", 10, BigDecimal.ZERO, 1), comments, at);
        return review;
    }

    private Review failed(PullRequest pr, LocalDateTime at) {
        Review review = store.openReview(pr, ReviewType.FULL_REVIEW, at).orElseThrow();
        return store.failReview(review.getId(), "boom", at);
    }

    @Test
    void getReview_returnsReviewWithCommentsInOrder() {
        Review review = completed(prA, NOW, 75, Severity.LOW, Severity.CRITICAL);

        ReviewDetails details = service.getReview(review.getId()).orElseThrow();

        assertEquals(review.getId(), details.review().getId());
        assertEquals(List.of(Severity.LOW, Severity.CRITICAL),
                details.comments().stream().map(ReviewComment::getSeverity).toList());
    }

    @Test
    void getReview_unknownIdIsNotFound() {
        assertEquals(ErrorKind.NOT_FOUND, service.getReview(404L).errorKind());
    }

    @Test
    void listReviews_newestFirstWithFilters() {
        Review oldest = completed(prA, NOW.minusHours(3), 70);
        Review middle = failed(prB, NOW.minusHours(2));
        Review newest = completed(prA, NOW.minusHours(1), 80);

        ReviewPage all = service.listReviews(null, null, null, null).orElseThrow();
        assertEquals(List.of(newest.getId(), middle.getId(), oldest.getId()),
                all.reviews().stream().map(Review::getId).toList());
        assertEquals(3, all.total());
        assertEquals(ReviewQueryService.DEFAULT_LIMIT, all.limit());

        ReviewPage completedOnly = service.listReviews("completed", null, null, null).orElseThrow();
        assertEquals(2, completedOnly.total());
        assertTrue(completedOnly.reviews().stream().allMatch(r -> r.getStatus() == ReviewStatus.COMPLETED));

        ReviewPage forB = service.listReviews(null, prB.getId(), null, null).orElseThrow();
        assertEquals(List.of(middle.getId()), forB.reviews().stream().map(Review::getId).toList());
    }

    @Test
    void listReviews_pagesAndCapsLimit() {
        for (int i = 0; i < 5; i++) {
            completed(prA, NOW.minusMinutes(10 - i), 80);
        }

        ReviewPage page = service.listReviews(null, null, 2, 1).orElseThrow();
        assertEquals(2, page.reviews().size());
        assertEquals(5, page.total());
        assertEquals(1, page.offset());

        assertEquals(ReviewQueryService.MAX_LIMIT, service.listReviews(null, null, 500, 0).orElseThrow().limit());
    }

    @Test
    void listReviews_rejectsBadArguments() {
        assertEquals(ErrorKind.VALIDATION, service.listReviews("archived", null, null, null).errorKind());
        assertEquals(ErrorKind.VALIDATION, service.listReviews(null, null, 0, null).errorKind());
        assertEquals(ErrorKind.VALIDATION, service.listReviews(null, null, null, -1).errorKind());
    }

    @Test
    void stats_aggregatesRecentReviews() {
        completed(prA, NOW.minusDays(1), 80, Severity.CRITICAL, Severity.LOW);
        completed(prA, NOW.minusDays(2), 60, Severity.LOW);
        failed(prB, NOW.minusDays(3));
        failed(prB, NOW.minusDays(4));
        completed(prB, NOW.minusDays(40), 10, Severity.HIGH);

        ReviewStats stats = service.stats(null).orElseThrow();

        assertEquals(30, stats.periodDays());
        assertEquals(4, stats.totalReviews());
        assertEquals(2, stats.completedReviews());
        assertEquals(2, stats.failedReviews());
        assertEquals(50.0, stats.successRate(), 0.0001);
        assertEquals(70.0, stats.averageScores().overall(), 0.0001);
        assertEquals(90.0, stats.averageScores().security(), 0.0001);
        assertEquals(List.of("critical", "high", "medium", "low"),
                List.copyOf(stats.commentSeverityDistribution().keySet()));
        assertEquals(1L, stats.commentSeverityDistribution().get("critical"));
        assertEquals(0L, stats.commentSeverityDistribution().get("high"));
        assertEquals(2L, stats.commentSeverityDistribution().get("low"));
    }

    @Test
    void stats_emptyPeriodIsAllZero() {
        ReviewStats stats = service.stats(7).orElseThrow();

        assertEquals(0, stats.totalReviews());
        assertEquals(0.0, stats.successRate());
        assertEquals(0.0, stats.averageScores().overall());
        assertTrue(stats.commentSeverityDistribution().values().stream().allMatch(v -> v == 0L));
    }

    @Test
    void stats_rejectsOutOfRangePeriod() {
        assertEquals(ErrorKind.VALIDATION, service.stats(0).errorKind());
        assertEquals(ErrorKind.VALIDATION, service.stats(366).errorKind());
    }
}
