package com.dbbaskette.codeguardian.service.store;

import com.dbbaskette.codeguardian.model.CommentFeedback;
import com.dbbaskette.codeguardian.model.PullRequest;
import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.model.ReviewType;
import com.dbbaskette.codeguardian.model.Severity;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed store for pull requests, reviews and their comments.
 *
 * <p>Implementations must make {@link #openReview} an atomic compare-and-set: when it returns a
 * review, that review is durably IN_PROGRESS and no other non-terminal review exists for the
 * same pull request.</p>
 */
public interface ReviewStore {

    Optional<PullRequest> findPullRequest(Long pullRequestId);

    /**
     * Creates a PENDING review and moves it to IN_PROGRESS in one step.
     *
     * @return the opened review, or empty if the pull request already has a non-terminal review
     */
    Optional<Review> openReview(PullRequest pullRequest, ReviewType reviewType, LocalDateTime now);

    /**
     * Writes the outcome and all comments, and marks the review COMPLETED, all at once.
     * Comments are persisted in list order.
     */
    Review completeReview(Long reviewId, ReviewOutcome outcome, List<ReviewComment> comments, LocalDateTime now);

    Review failReview(Long reviewId, String reason, LocalDateTime now);

    Optional<Review> findReview(Long reviewId);

    /**
     * @return the review's comments in provider order
     */
    List<ReviewComment> findComments(Long reviewId);

    Optional<ReviewComment> findComment(Long reviewId, Long commentId);

    Optional<ReviewComment> findCommentById(Long commentId);

    ReviewComment updateCommentFeedback(Long commentId, CommentFeedback feedback, LocalDateTime now);

    List<Review> findReviews(ReviewFilter filter);

    long countReviews(ReviewFilter filter);

    List<Review> findReviewsCreatedSince(LocalDateTime since);

    Map<Severity, Long> countCommentsBySeverity(Collection<Long> reviewIds);

    long countActiveReviews();
}
