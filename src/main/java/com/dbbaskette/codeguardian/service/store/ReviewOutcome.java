package com.dbbaskette.codeguardian.service.store;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything written onto a review when it completes, with provider gaps already defaulted.
 */
public record ReviewOutcome(
        double overallScore,
        double securityScore,
        double performanceScore,
        double maintainabilityScore,
        String summary,
        List<String> recommendations,
        String modelUsed,
        long tokensUsed,
        BigDecimal estimatedCost,
        long processingTimeMs
) {
    public ReviewOutcome {
        recommendations = List.copyOf(recommendations);
    }
}
