package com.dbbaskette.codeguardian.service.review;

import java.util.Map;

/**
 * Aggregates over the reviews created in the last {@code periodDays} days.
 * Average scores cover completed reviews only and are 0 when there are none.
 */
public record ReviewStats(
        int periodDays,
        long totalReviews,
        long completedReviews,
        long failedReviews,
        double successRate,
        AverageScores averageScores,
        Map<String, Long> commentSeverityDistribution
) {
    public record AverageScores(double overall, double security, double performance, double maintainability) {}
}
