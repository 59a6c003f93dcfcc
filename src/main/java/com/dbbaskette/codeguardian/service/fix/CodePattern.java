package com.dbbaskette.codeguardian.service.fix;

import com.dbbaskette.codeguardian.model.ReviewCategory;
import com.dbbaskette.codeguardian.model.Severity;

import java.util.List;

/**
 * Line patterns checked by the ad-hoc snippet scan. Severity, confidence and
 * auto-applicability are fixed per pattern and do not follow the review severity rule.
 */
public enum CodePattern {

    /** Query execution with inline placeholder interpolation. */
    SQL_INTERPOLATION(1, ReviewCategory.SECURITY, Severity.CRITICAL, 0.95, true,
            "Use parameterized queries to prevent SQL injection") {
        @Override
        boolean matches(String line) {
            return line.contains("execute(") && line.contains("%");
        }

        @Override
        String suggest(String line) {
            return line.replace("%s", "?").replace("%", "").strip();
        }
    },

    STRING_CONCATENATION(2, ReviewCategory.PERFORMANCE, Severity.MEDIUM, 0.75, false,
            "String concatenation with += is O(n^2). Use join() for better performance.") {
        @Override
        boolean matches(String line) {
            return line.contains("+=")
                    && (line.contains("str") || line.contains("\"") || line.contains("'"));
        }

        @Override
        String suggest(String line) {
            return "# Consider using ''.join() for string concatenation";
        }
    },

    HARDCODED_CREDENTIAL(3, ReviewCategory.SECURITY, Severity.CRITICAL, 0.90, false,
            "Hardcoded credentials should be moved to environment variables") {
        private final List<String> keywords = List.of("password", "secret", "api_key");

        @Override
        boolean matches(String line) {
            String lower = line.toLowerCase();
            return keywords.stream().anyMatch(lower::contains)
                    && line.contains("=")
                    && (line.contains("\"") || line.contains("'"));
        }

        @Override
        String suggest(String line) {
            return "# Move to environment variables: os.environ.get('SECRET_NAME')";
        }
    };

    private final int number;
    private final ReviewCategory category;
    private final Severity severity;
    private final double confidence;
    private final boolean autoApplicable;
    private final String explanation;

    CodePattern(int number, ReviewCategory category, Severity severity, double confidence,
                boolean autoApplicable, String explanation) {
        this.number = number;
        this.category = category;
        this.severity = severity;
        this.confidence = confidence;
        this.autoApplicable = autoApplicable;
        this.explanation = explanation;
    }

    abstract boolean matches(String line);

    abstract String suggest(String line);

    public Severity severity() { return severity; }

    public boolean autoApplicable() { return autoApplicable; }

    /**
     * @param lineNumber 1-based line number of {@code line} in the snippet
     */
    FixSuggestion toFix(int lineNumber, String line) {
        return new FixSuggestion(
                "fix_inline_" + lineNumber + "_" + number,
                lineNumber,
                category,
                severity,
                line.strip(),
                suggest(line),
                explanation,
                confidence,
                autoApplicable
        );
    }
}
