package com.dbbaskette.codeguardian.service.analysis;

import com.dbbaskette.codeguardian.model.ReviewType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisPromptBuilderTest {

    private final AnalysisPromptBuilder builder = new AnalysisPromptBuilder();

    private static AnalysisSubject subject(ReviewType type, String description) {
        return new AnalysisSubject("acme", "shop", 42, "Add checkout", description, type);
    }

    @Test
    void buildReviewPrompt_includesPullRequestAndDiff() {
        String prompt = builder.buildReviewPrompt(subject(ReviewType.FULL_REVIEW, "Adds a cart"),
                "+ cart.add(item)", 15000);

        assertTrue(prompt.contains("acme/shop"));
        assertTrue(prompt.contains("**PR #42:** Add checkout"));
        assertTrue(prompt.contains("Adds a cart"));
        assertTrue(prompt.contains("+ cart.add(item)"));
        assertTrue(prompt.contains("\"maintainability_score\""));
        assertFalse(prompt.contains("security scan"));
    }

    @Test
    void buildReviewPrompt_truncatesLongDiff() {
        String diff = "x".repeat(2000);

        String prompt = builder.buildReviewPrompt(subject(ReviewType.FULL_REVIEW, null), diff, 1000);

        assertTrue(prompt.contains("x".repeat(1000) + "\n... (truncated)"));
        assertFalse(prompt.contains("x".repeat(1001)));
        assertTrue(prompt.contains("No description"));
    }

    @Test
    void buildReviewPrompt_missingDiff() {
        String prompt = builder.buildReviewPrompt(subject(ReviewType.FULL_REVIEW, ""), null, 1000);

        assertTrue(prompt.contains("The diff is not available"));
    }

    @Test
    void buildReviewPrompt_reviewTypeSections() {
        assertTrue(builder.buildReviewPrompt(subject(ReviewType.SECURITY_SCAN, null), "d", 1000)
                .contains("This is a security scan"));
        assertTrue(builder.buildReviewPrompt(subject(ReviewType.INCREMENTAL, null), "d", 1000)
                .contains("Only comment on lines added or changed"));
    }
}
