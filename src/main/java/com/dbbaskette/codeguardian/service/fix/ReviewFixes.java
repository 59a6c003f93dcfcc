package com.dbbaskette.codeguardian.service.fix;

import java.util.List;

/**
 * Fix listing for one review (or one ad-hoc snippet when {@code language} is set).
 */
public record ReviewFixes(
        Long reviewId,
        String language,
        List<FixSuggestion> fixes,
        int totalFixes,
        int autoApplicableCount
) {
    public static ReviewFixes forReview(Long reviewId, List<FixSuggestion> fixes) {
        return new ReviewFixes(reviewId, null, fixes, fixes.size(), countAutoApplicable(fixes));
    }

    public static ReviewFixes forSnippet(String language, List<FixSuggestion> fixes) {
        return new ReviewFixes(null, language, fixes, fixes.size(), countAutoApplicable(fixes));
    }

    private static int countAutoApplicable(List<FixSuggestion> fixes) {
        return (int) fixes.stream().filter(FixSuggestion::autoApplicable).count();
    }
}
