package com.dbbaskette.codeguardian.service.fix;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Maps review comments to fix suggestions. Holds no mutable state; the same comment always
 * yields the same suggestion.
 */
@Component
public class FixSuggestionEngine {

    static final Comparator<FixSuggestion> SEVERITY_ORDER =
            Comparator.comparingInt(fix -> fix.severity().rank());

    private final double confidence;

    public FixSuggestionEngine(CodeGuardianProperties properties) {
        this.confidence = properties.getFixes().getConfidence();
    }

    public Optional<FixSuggestion> suggest(ReviewComment comment) {
        if (!comment.hasSuggestion()) {
            return Optional.empty();
        }

        String originalCode;
        String fixedCode;
        if (hasText(comment.getOriginalCode()) && hasText(comment.getSuggestedCode())) {
            originalCode = comment.getOriginalCode();
            fixedCode = comment.getSuggestedCode();
        } else {
            SampleFixTable sample = SampleFixTable.forCategory(comment.getCategory());
            originalCode = sample.originalCode();
            fixedCode = sample.fixedCode();
        }

        return Optional.of(new FixSuggestion(
                FixIds.forComment(comment.getId()),
                comment.getLineNumber() != null ? comment.getLineNumber() : 0,
                comment.getCategory(),
                comment.getSeverity(),
                originalCode,
                fixedCode,
                comment.getSuggestedFix(),
                confidence,
                isAutoApplicable(comment)
        ));
    }

    /**
     * Suggestions for all comments that have one, critical first. Equal severities keep
     * comment order.
     */
    public List<FixSuggestion> suggestAll(List<ReviewComment> comments) {
        return comments.stream()
                .map(this::suggest)
                .flatMap(Optional::stream)
                .sorted(SEVERITY_ORDER)
                .toList();
    }

    /**
     * Critical findings always need a human.
     */
    static boolean isAutoApplicable(ReviewComment comment) {
        return comment.hasSuggestion() && comment.getSeverity() != Severity.CRITICAL;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
