package com.dbbaskette.codeguardian.service.fix;

import com.dbbaskette.codeguardian.model.ReviewCategory;

/**
 * Representative before/after snippets, used when a comment carries no code of its own.
 * Entries are matched in declaration order; {@link #GENERIC} matches everything.
 */
public enum SampleFixTable {
    SECURITY(ReviewCategory.SECURITY,
            "password = request.args.get('pwd')",
            "password = request.form.get('pwd')  # Use POST instead of GET"),
    PERFORMANCE(ReviewCategory.PERFORMANCE,
            "for item in items:\n    result.append(process(item))",
            "result = [process(item) for item in items]  # List comprehension"),
    MAINTAINABILITY(ReviewCategory.MAINTAINABILITY,
            "def func(a, b, c, d, e, f, g):\n    return a + b + c + d + e + f + g",
            "def func(config: Config):\n    return sum(config.values)"),
    GENERIC(null,
            "# Original code would appear here",
            "# Fixed code would appear here");

    private final ReviewCategory category;
    private final String originalCode;
    private final String fixedCode;

    SampleFixTable(ReviewCategory category, String originalCode, String fixedCode) {
        this.category = category;
        this.originalCode = originalCode;
        this.fixedCode = fixedCode;
    }

    public String originalCode() { return originalCode; }

    public String fixedCode() { return fixedCode; }

    boolean matches(ReviewCategory candidate) {
        return category == null || category == candidate;
    }

    public static SampleFixTable forCategory(ReviewCategory category) {
        for (SampleFixTable entry : values()) {
            if (entry.matches(category)) {
                return entry;
            }
        }
        return GENERIC;
    }
}
