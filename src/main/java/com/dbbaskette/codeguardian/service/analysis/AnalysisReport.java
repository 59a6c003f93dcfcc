package com.dbbaskette.codeguardian.service.analysis;

import java.util.List;

/**
 * Provider answer for one subject. Any field may be null when the provider left it out;
 * the orchestrator applies fallbacks.
 */
public record AnalysisReport(
        Double overallScore,
        Double securityScore,
        Double performanceScore,
        Double maintainabilityScore,
        String summary,
        List<String> recommendations,
        List<ReportedComment> comments,
        String modelUsed,
        Long tokensUsed
) {
    public AnalysisReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public record ReportedComment(
            String filePath,
            Integer lineNumber,
            String type,
            String severity,
            String category,
            String title,
            String message,
            String suggestedFix,
            String originalCode,
            String suggestedCode
    ) {}
}
