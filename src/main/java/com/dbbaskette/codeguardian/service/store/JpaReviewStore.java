package com.dbbaskette.codeguardian.service.store;

import com.dbbaskette.codeguardian.model.CommentFeedback;
import com.dbbaskette.codeguardian.model.PullRequest;
import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.model.ReviewStatus;
import com.dbbaskette.codeguardian.model.ReviewType;
import com.dbbaskette.codeguardian.model.Severity;
import com.dbbaskette.codeguardian.repository.PullRequestRepository;
import com.dbbaskette.codeguardian.repository.ReviewCommentRepository;
import com.dbbaskette.codeguardian.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * {@link ReviewStore} backed by Spring Data JPA.
 *
 * <p>One non-terminal review per pull request is enforced by the unique
 * {@code active_pull_request_id} column. Each write runs in its own transaction so that
 * its result is committed before the caller moves on (in particular before the analysis
 * provider is called).</p>
 */
@Component
public class JpaReviewStore implements ReviewStore {

    private static final Logger log = LoggerFactory.getLogger(JpaReviewStore.class);

    private final PullRequestRepository pullRequestRepository;
    private final ReviewRepository reviewRepository;
    private final ReviewCommentRepository commentRepository;
    private final TransactionTemplate tx;

    public JpaReviewStore(PullRequestRepository pullRequestRepository,
                          ReviewRepository reviewRepository,
                          ReviewCommentRepository commentRepository,
                          PlatformTransactionManager transactionManager) {
        this.pullRequestRepository = pullRequestRepository;
        this.reviewRepository = reviewRepository;
        this.commentRepository = commentRepository;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<PullRequest> findPullRequest(Long pullRequestId) {
        return pullRequestRepository.findById(pullRequestId);
    }

    @Override
    public Optional<Review> openReview(PullRequest pullRequest, ReviewType reviewType, LocalDateTime now) {
        try {
            return Optional.ofNullable(tx.execute(status -> {
                if (reviewRepository.existsByActivePullRequestId(pullRequest.getId())) {
                    return null;
                }
                Review review = reviewRepository.saveAndFlush(new Review(pullRequest, reviewType, now));
                review.transitionTo(ReviewStatus.IN_PROGRESS, now);
                return reviewRepository.saveAndFlush(review);
            }));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // A concurrent trigger won the insert race
            log.info("Concurrent review open rejected for pull request {}", pullRequest.getId());
            return Optional.empty();
        }
    }

    @Override
    public Review completeReview(Long reviewId, ReviewOutcome outcome, List<ReviewComment> comments,
                                 LocalDateTime now) {
        return tx.execute(status -> {
            Review review = requireReview(reviewId);
            review.setOverallScore(outcome.overallScore());
            review.setSecurityScore(outcome.securityScore());
            review.setPerformanceScore(outcome.performanceScore());
            review.setMaintainabilityScore(outcome.maintainabilityScore());
            review.setSummary(outcome.summary());
            review.setRecommendations(outcome.recommendations());
            review.setModelUsed(outcome.modelUsed());
            review.setTokensUsed(outcome.tokensUsed());
            review.setEstimatedCost(outcome.estimatedCost());
            review.setProcessingTimeMs(outcome.processingTimeMs());
            review.transitionTo(ReviewStatus.COMPLETED, now);
            // saveAll keeps list order, so identity ids follow provider order too
            commentRepository.saveAll(comments);
            return reviewRepository.save(review);
        });
    }

    @Override
    public Review failReview(Long reviewId, String reason, LocalDateTime now) {
        return tx.execute(status -> {
            Review review = requireReview(reviewId);
            review.setErrorMessage(reason);
            review.transitionTo(ReviewStatus.FAILED, now);
            return reviewRepository.save(review);
        });
    }

    @Override
    public Optional<Review> findReview(Long reviewId) {
        return reviewRepository.findById(reviewId);
    }

    @Override
    public List<ReviewComment> findComments(Long reviewId) {
        return commentRepository.findByReviewIdOrderByPositionAsc(reviewId);
    }

    @Override
    public Optional<ReviewComment> findComment(Long reviewId, Long commentId) {
        return commentRepository.findByIdAndReviewId(commentId, reviewId);
    }

    @Override
    public Optional<ReviewComment> findCommentById(Long commentId) {
        return commentRepository.findById(commentId);
    }

    @Override
    public ReviewComment updateCommentFeedback(Long commentId, CommentFeedback feedback, LocalDateTime now) {
        return tx.execute(status -> {
            ReviewComment comment = commentRepository.findById(commentId)
                    .orElseThrow(() -> new NoSuchElementException("Comment " + commentId));
            comment.recordFeedback(feedback, now);
            return commentRepository.save(comment);
        });
    }

    @Override
    public List<Review> findReviews(ReviewFilter filter) {
        if (filter.offset() % filter.limit() == 0) {
            return reviewRepository.search(filter.status(), filter.pullRequestId(),
                    PageRequest.of(filter.offset() / filter.limit(), filter.limit()));
        }
        // Unaligned offset: read up to the end of the window and slice
        List<Review> head = reviewRepository.search(filter.status(), filter.pullRequestId(),
                PageRequest.of(0, filter.offset() + filter.limit()));
        return head.stream().skip(filter.offset()).toList();
    }

    @Override
    public long countReviews(ReviewFilter filter) {
        return reviewRepository.countMatching(filter.status(), filter.pullRequestId());
    }

    @Override
    public List<Review> findReviewsCreatedSince(LocalDateTime since) {
        return reviewRepository.findByCreatedAtGreaterThanEqual(since);
    }

    @Override
    public Map<Severity, Long> countCommentsBySeverity(Collection<Long> reviewIds) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        if (reviewIds.isEmpty()) {
            return counts;
        }
        for (Object[] row : commentRepository.countBySeverity(reviewIds)) {
            counts.put((Severity) row[0], (Long) row[1]);
        }
        return counts;
    }

    @Override
    public long countActiveReviews() {
        return reviewRepository.countByStatusIn(List.of(ReviewStatus.PENDING, ReviewStatus.IN_PROGRESS));
    }

    private Review requireReview(Long reviewId) {
        return reviewRepository.findById(reviewId)
                .orElseThrow(() -> new NoSuchElementException("Review " + reviewId));
    }
}
