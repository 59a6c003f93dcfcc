package com.dbbaskette.codeguardian.service.analysis;

import com.dbbaskette.codeguardian.model.ReviewType;
import org.springframework.stereotype.Component;

/**
 * Builds the structured review prompt sent to the chat model.
 */
@Component
public class AnalysisPromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are CodeGuardian, an independent code reviewer. You review pull request \
            changes for security, performance and maintainability problems and answer \
            only with the JSON document requested.
            """;

    /**
     * Build the review prompt for a pull request.
     *
     * @param subject      the pull request under review
     * @param diff         unified diff of the pull request, may be null if it could not be fetched
     * @param maxDiffChars diff is cut to this length
     * @return the complete prompt
     */
    public String buildReviewPrompt(AnalysisSubject subject, String diff, int maxDiffChars) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("""
                Analyze this pull request and provide a comprehensive code review.

                ## Pull Request

                **Repository:** %s
                **PR #%d:** %s

                **Description:**
                %s
                """.formatted(subject.fullName(), subject.pullRequestNumber(),
                subject.title() != null ? subject.title() : "Untitled",
                subject.description() != null && !subject.description().isBlank()
                        ? subject.description() : "No description"));

        if (diff != null && !diff.isBlank()) {
            prompt.append("""

                    ## Diff

                    ```
                    %s
                    ```
                    """.formatted(truncate(diff, maxDiffChars)));
        } else {
            prompt.append("\nThe diff is not available; base the review on the title and description.\n");
        }

        prompt.append("""

                ## Review Instructions

                Score each dimension from 0 to 100:

                1. **Overall** (overall_score): general quality of the change.
                2. **Security** (security_score): injection, secrets in code, missing authorization, \
                unsafe input handling.
                3. **Performance** (performance_score): needless work in loops, N+1 access, \
                blocking calls, memory growth.
                4. **Maintainability** (maintainability_score): naming, structure, duplication, \
                test coverage of the change.
                """);

        if (subject.reviewType() == ReviewType.SECURITY_SCAN) {
            prompt.append(buildSecuritySection());
        } else if (subject.reviewType() == ReviewType.INCREMENTAL) {
            prompt.append("\nOnly comment on lines added or changed by this diff.\n");
        }

        prompt.append("""

                ## Response Format

                Respond with ONLY a JSON object (no markdown fences, no explanation before or after). \
                Use this exact structure:

                {"overall_score": 85, "security_score": 90, "performance_score": 80, \
                "maintainability_score": 88, "summary": "1-3 sentence assessment", \
                "recommendations": ["Short actionable recommendation"], \
                "comments": [{"file_path": "src/api/auth.ts", "line_number": 23, "type": "warning", \
                "severity": "high", "category": "security", "title": "Short title", \
                "message": "What is wrong", "suggested_fix": "How to fix it", \
                "original_code": "offending code", "suggested_code": "fixed code"}]}

                **Valid severities:** low, medium, high, critical
                **Valid categories:** security, performance, maintainability, style, best_practice, \
                bug, documentation
                **Valid types:** suggestion, warning, error, info

                List comments in the order a reviewer should read them.
                """);

        return prompt.toString();
    }

    private String buildSecuritySection() {
        return """

                This is a security scan. Check the changed code thoroughly for:
                   - Injection vulnerabilities: SQL, command, template injection, XSS
                   - Sensitive data exposure: hardcoded secrets, API keys, credentials in logs
                   - Broken access control: missing authorization checks, IDOR
                   - Unsafe deserialization and path traversal
                Mark anything exploitable as "critical".
                """;
    }

    private String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "\n... (truncated)";
    }
}
