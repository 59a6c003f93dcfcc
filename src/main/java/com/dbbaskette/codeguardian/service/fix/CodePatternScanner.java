package com.dbbaskette.codeguardian.service.fix;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import com.dbbaskette.codeguardian.service.result.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scans a code snippet line by line for {@link CodePattern}s, without a review.
 */
@Component
public class CodePatternScanner {

    private static final Logger log = LoggerFactory.getLogger(CodePatternScanner.class);

    public static final String DEFAULT_LANGUAGE = "javascript";

    public static final Set<String> SUPPORTED_LANGUAGES = Set.of(
            "javascript", "typescript", "python", "java", "cpp", "c",
            "csharp", "go", "rust", "php", "ruby", "swift", "kotlin",
            "scala", "dart", "r", "shell", "sql", "html", "css");

    private final int minCodeChars;
    private final int maxCodeBytes;

    public CodePatternScanner(CodeGuardianProperties properties) {
        this.minCodeChars = properties.getAdhoc().getMinCodeChars();
        this.maxCodeBytes = properties.getAdhoc().getMaxCodeBytes();
    }

    public OperationResult<ReviewFixes> scan(String code, String language) {
        if (code == null) {
            return OperationResult.validation("code is required", "code");
        }
        if (code.length() < minCodeChars) {
            return OperationResult.validation("Code must be at least " + minCodeChars + " characters", "code");
        }
        if (code.getBytes(StandardCharsets.UTF_8).length > maxCodeBytes) {
            return OperationResult.validation("Code exceeds maximum size of " + maxCodeBytes + " bytes", "code");
        }
        String lang = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language.trim().toLowerCase();
        if (!SUPPORTED_LANGUAGES.contains(lang)) {
            return OperationResult.validation("Unsupported language: " + language, "language");
        }

        List<FixSuggestion> fixes = new ArrayList<>();
        String[] lines = code.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            for (CodePattern pattern : CodePattern.values()) {
                if (pattern.matches(lines[i])) {
                    fixes.add(pattern.toFix(i + 1, lines[i]));
                }
            }
        }

        log.debug("Ad-hoc {} scan of {} lines found {} fixes", lang, lines.length, fixes.size());
        return OperationResult.success(ReviewFixes.forSnippet(lang, fixes));
    }
}
