package com.dbbaskette.codeguardian.service.store;

import com.dbbaskette.codeguardian.model.CommentFeedback;
import com.dbbaskette.codeguardian.model.PullRequest;
import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewCategory;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.model.ReviewStatus;
import com.dbbaskette.codeguardian.model.ReviewType;
import com.dbbaskette.codeguardian.model.Severity;
import com.dbbaskette.codeguardian.repository.PullRequestRepository;
import com.dbbaskette.codeguardian.repository.ReviewCommentRepository;
import com.dbbaskette.codeguardian.repository.ReviewRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against H2 without a wrapping test transaction so each store call commits on its own.
 */
@DataJpaTest
@Import(JpaReviewStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaReviewStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 15, 10, 0);

    @Autowired
    private JpaReviewStore store;

    @Autowired
    private PullRequestRepository pullRequestRepository;

    @Autowired
    private ReviewRepository reviewRepository;

    @Autowired
    private ReviewCommentRepository commentRepository;

    private PullRequest pr;

    @BeforeEach
    void setUp() {
        pr = pullRequestRepository.save(new PullRequest("acme", "shop", 42, "Add checkout"));
    }

    @AfterEach
    void tearDown() {
        commentRepository.deleteAll();
        reviewRepository.deleteAll();
        pullRequestRepository.deleteAll();
    }

    private static ReviewOutcome outcome() {
        return new ReviewOutcome(80, 70, 60, 90, "Looks fine", List.of("Add tests"), "model", 500,
                new BigDecimal("0.0045"), 12);
    }

    private static ReviewComment comment(Long reviewId, int position, Severity severity) {
        ReviewComment comment = new ReviewComment(reviewId, position, NOW);
        comment.setFilePath("src/app.py");
        comment.setSeverity(severity);
        comment.setCategory(ReviewCategory.BUG);
        comment.setTitle("Finding " + position);
        comment.setMessage("Message " + position);
        comment.setSuggestedFix("Fix " + position);
        return comment;
    }

    @Test
    void openReview_commitsInProgressReview() {
        Review review = store.openReview(pr, ReviewType.SECURITY_SCAN, NOW).orElseThrow();

        Review stored = reviewRepository.findById(review.getId()).orElseThrow();
        assertEquals(ReviewStatus.IN_PROGRESS, stored.getStatus());
        assertEquals(ReviewType.SECURITY_SCAN, stored.getReviewType());
        assertEquals(NOW, stored.getStartedAt());
        assertEquals(1, store.countActiveReviews());
    }

    @Test
    void openReview_rejectsSecondActiveReview() {
        store.openReview(pr, ReviewType.FULL_REVIEW, NOW).orElseThrow();

        assertTrue(store.openReview(pr, ReviewType.FULL_REVIEW, NOW).isEmpty());
        assertEquals(1, reviewRepository.count());
    }

    @Test
    void openReview_allowedAgainAfterTerminalState() {
        Review first = store.openReview(pr, ReviewType.FULL_REVIEW, NOW).orElseThrow();
        store.failReview(first.getId(), "timeout", NOW.plusMinutes(1));

        Optional<Review> second = store.openReview(pr, ReviewType.FULL_REVIEW, NOW.plusMinutes(2));

        assertTrue(second.isPresent());
        Review failed = store.findReview(first.getId()).orElseThrow();
        assertEquals(ReviewStatus.FAILED, failed.getStatus());
        assertEquals("timeout", failed.getErrorMessage());
    }

    @Test
    void openReview_concurrentCallersGetOneReview() throws Exception {
        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Optional<Review>>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.openReview(pr, ReviewType.FULL_REVIEW, NOW);
                }));
            }
            start.countDown();

            int opened = 0;
            for (Future<Optional<Review>> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).isPresent()) opened++;
            }
            assertEquals(1, opened);
            assertEquals(1, reviewRepository.count());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void completeReview_writesOutcomeAndCommentsInOrder() {
        Review review = store.openReview(pr, ReviewType.FULL_REVIEW, NOW).orElseThrow();
        List<ReviewComment> comments = List.of(
                comment(review.getId(), 0, Severity.LOW),
                comment(review.getId(), 1, Severity.CRITICAL),
                comment(review.getId(), 2, Severity.LOW));

        store.completeReview(review.getId(), outcome(), comments, NOW.plusSeconds(12));

        Review stored = store.findReview(review.getId()).orElseThrow();
        assertEquals(ReviewStatus.COMPLETED, stored.getStatus());
        assertEquals(80.0, stored.getOverallScore());
        assertEquals(List.of("Add tests"), stored.getRecommendations());
        assertEquals(0, new BigDecimal("0.0045").compareTo(stored.getEstimatedCost()));
        assertEquals(0, store.countActiveReviews());

        List<ReviewComment> stored2 = store.findComments(review.getId());
        assertEquals(List.of("Finding 0", "Finding 1", "Finding 2"),
                stored2.stream().map(ReviewComment::getTitle).toList());

        Map<Severity, Long> counts = store.countCommentsBySeverity(List.of(review.getId()));
        assertEquals(2L, counts.get(Severity.LOW));
        assertEquals(1L, counts.get(Severity.CRITICAL));
        assertTrue(store.countCommentsBySeverity(List.of()).isEmpty());
    }

    @Test
    void findComment_scopedToReview() {
        Review review = store.openReview(pr, ReviewType.FULL_REVIEW, NOW).orElseThrow();
        store.completeReview(review.getId(), outcome(), List.of(comment(review.getId(), 0, Severity.HIGH)), NOW);
        Long commentId = store.findComments(review.getId()).get(0).getId();

        assertTrue(store.findComment(review.getId(), commentId).isPresent());
        assertTrue(store.findComment(review.getId() + 1000, commentId).isEmpty());
    }

    @Test
    void updateCommentFeedback_persistsResolution() {
        Review review = store.openReview(pr, ReviewType.FULL_REVIEW, NOW).orElseThrow();
        store.completeReview(review.getId(), outcome(), List.of(comment(review.getId(), 0, Severity.HIGH)), NOW);
        Long commentId = store.findComments(review.getId()).get(0).getId();

        store.updateCommentFeedback(commentId, CommentFeedback.APPLIED, NOW.plusHours(1));

        ReviewComment stored = store.findCommentById(commentId).orElseThrow();
        assertEquals(CommentFeedback.APPLIED, stored.getUserFeedback());
        assertTrue(stored.isResolved());
        assertEquals(NOW.plusHours(1), stored.getResolvedAt());
    }

    @Test
    void findReviews_filtersAndPagesNewestFirst() {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Review review = store.openReview(pr, ReviewType.FULL_REVIEW, NOW.plusMinutes(i)).orElseThrow();
            if (i % 2 == 0) {
                store.completeReview(review.getId(), outcome(), List.of(), NOW.plusMinutes(i));
            } else {
                store.failReview(review.getId(), "boom", NOW.plusMinutes(i));
            }
            ids.add(review.getId());
        }

        List<Review> page = store.findReviews(new ReviewFilter(null, pr.getId(), 1, 3));
        assertEquals(List.of(ids.get(3), ids.get(2), ids.get(1)), page.stream().map(Review::getId).toList());

        ReviewFilter completed = new ReviewFilter(ReviewStatus.COMPLETED, null, 0, 10);
        assertEquals(3, store.countReviews(completed));
        assertEquals(List.of(ids.get(4), ids.get(2), ids.get(0)),
                store.findReviews(completed).stream().map(Review::getId).toList());

        assertEquals(2, store.findReviewsCreatedSince(NOW.plusMinutes(3)).size());
    }
}
