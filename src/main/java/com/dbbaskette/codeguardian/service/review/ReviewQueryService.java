package com.dbbaskette.codeguardian.service.review;

import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewStatus;
import com.dbbaskette.codeguardian.model.Severity;
import com.dbbaskette.codeguardian.service.result.OperationResult;
import com.dbbaskette.codeguardian.service.store.ReviewFilter;
import com.dbbaskette.codeguardian.service.store.ReviewStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Read side of reviews: single lookup, listing and statistics.
 */
@Service
public class ReviewQueryService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;
    public static final int DEFAULT_STATS_DAYS = 30;
    public static final int MAX_STATS_DAYS = 365;

    private final ReviewStore store;
    private final Clock clock;

    public ReviewQueryService(ReviewStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public OperationResult<ReviewDetails> getReview(Long reviewId) {
        return store.findReview(reviewId)
                .map(review -> OperationResult.success(new ReviewDetails(review, store.findComments(reviewId))))
                .orElseGet(() -> OperationResult.notFound("Review", reviewId));
    }

    /**
     * Newest first. A null limit means {@value #DEFAULT_LIMIT}; limits above {@value #MAX_LIMIT} are capped.
     */
    public OperationResult<ReviewPage> listReviews(String status, Long pullRequestId, Integer limit, Integer offset) {
        ReviewStatus statusFilter = null;
        if (status != null && !status.isBlank()) {
            try {
                statusFilter = ReviewStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return OperationResult.validation("Unknown status: " + status, "status");
            }
        }
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        if (effectiveLimit < 1) {
            return OperationResult.validation("limit must be at least 1", "limit");
        }
        int effectiveOffset = offset == null ? 0 : offset;
        if (effectiveOffset < 0) {
            return OperationResult.validation("offset must not be negative", "offset");
        }

        ReviewFilter filter = new ReviewFilter(statusFilter, pullRequestId, effectiveOffset, effectiveLimit);
        return OperationResult.success(new ReviewPage(store.findReviews(filter), store.countReviews(filter),
                effectiveLimit, effectiveOffset));
    }

    public OperationResult<ReviewStats> stats(Integer days) {
        int period = days == null ? DEFAULT_STATS_DAYS : days;
        if (period < 1 || period > MAX_STATS_DAYS) {
            return OperationResult.validation("days must be between 1 and " + MAX_STATS_DAYS, "days");
        }

        List<Review> reviews = store.findReviewsCreatedSince(LocalDateTime.now(clock).minusDays(period));
        List<Review> completed = reviews.stream()
                .filter(r -> r.getStatus() == ReviewStatus.COMPLETED)
                .toList();
        long failed = reviews.stream().filter(r -> r.getStatus() == ReviewStatus.FAILED).count();
        double successRate = reviews.isEmpty() ? 0.0 : completed.size() * 100.0 / reviews.size();

        ReviewStats.AverageScores averages = new ReviewStats.AverageScores(
                average(completed, Review::getOverallScore),
                average(completed, Review::getSecurityScore),
                average(completed, Review::getPerformanceScore),
                average(completed, Review::getMaintainabilityScore));

        Map<Severity, Long> counts = store.countCommentsBySeverity(completed.stream().map(Review::getId).toList());
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            distribution.put(severity.getLabel(), counts.getOrDefault(severity, 0L));
        }

        return OperationResult.success(new ReviewStats(period, reviews.size(), completed.size(), failed,
                successRate, averages, distribution));
    }

    private static double average(List<Review> reviews, Function<Review, Double> score) {
        return reviews.stream()
                .map(score)
                .filter(v -> v != null)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }
}
