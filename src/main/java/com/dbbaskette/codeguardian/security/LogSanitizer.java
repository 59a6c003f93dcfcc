package com.dbbaskette.codeguardian.security;

import java.util.regex.Pattern;

/**
 * Redacts credentials from text that ends up in logs or in stored failure reasons.
 */
public final class LogSanitizer {

    private static final Pattern GITHUB_TOKEN = Pattern.compile("((?:ghp|gho|ghs|github_pat)_[A-Za-z0-9_]{20,})");
    private static final Pattern ANTHROPIC_KEY = Pattern.compile("(sk-ant-[A-Za-z0-9_-]{20,})");
    private static final Pattern BEARER_TOKEN = Pattern.compile("(Bearer\\s+)[A-Za-z0-9._-]+");
    private static final Pattern GENERIC_SECRET = Pattern.compile(
            "((?:token|api[_-]?key|secret|password)\\s*[:=]\\s*)[^\\s,;]+", Pattern.CASE_INSENSITIVE);

    private static final int MAX_LENGTH = 500;

    private LogSanitizer() {}

    public static String sanitize(String input) {
        if (input == null) return null;
        String result = input;
        result = GITHUB_TOKEN.matcher(result).replaceAll("gh_***REDACTED***");
        result = ANTHROPIC_KEY.matcher(result).replaceAll("sk-ant-***REDACTED***");
        result = BEARER_TOKEN.matcher(result).replaceAll("$1***REDACTED***");
        result = GENERIC_SECRET.matcher(result).replaceAll("$1***REDACTED***");
        return result;
    }

    /**
     * Sanitize and cap the length, for reasons persisted on a failed review.
     */
    public static String sanitizeReason(String input) {
        String result = sanitize(input);
        if (result == null || result.isBlank()) return "Unknown error";
        return result.length() <= MAX_LENGTH ? result : result.substring(0, MAX_LENGTH) + "...";
    }
}
