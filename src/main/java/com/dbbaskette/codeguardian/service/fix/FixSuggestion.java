package com.dbbaskette.codeguardian.service.fix;

import com.dbbaskette.codeguardian.model.ReviewCategory;
import com.dbbaskette.codeguardian.model.Severity;

/**
 * Candidate remediation derived from one review comment (or one ad-hoc pattern match).
 * Never persisted.
 */
public record FixSuggestion(
        String id,
        int lineNumber,
        ReviewCategory issueType,
        Severity severity,
        String originalCode,
        String suggestedFix,
        String explanation,
        double confidence,
        boolean autoApplicable
) {}
