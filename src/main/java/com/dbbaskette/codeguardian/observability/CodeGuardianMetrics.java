package com.dbbaskette.codeguardian.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized Micrometer metrics for CodeGuardian.
 */
@Component
public class CodeGuardianMetrics {

    private final Counter reviewsTriggered;
    private final Counter reviewsCompleted;
    private final Counter reviewsFailed;
    private final Counter reviewsConflicted;
    private final Counter tokensTotal;
    private final Timer analysisDuration;
    private final Counter fixesApplied;
    private final Counter fixesSkipped;
    private final Counter fixesFailed;

    public CodeGuardianMetrics(MeterRegistry registry) {
        this.reviewsTriggered = Counter.builder("codeguardian.reviews.triggered")
                .description("Total review triggers accepted")
                .register(registry);

        this.reviewsCompleted = Counter.builder("codeguardian.reviews.completed")
                .description("Total reviews completed successfully")
                .register(registry);

        this.reviewsFailed = Counter.builder("codeguardian.reviews.failed")
                .description("Total reviews failed by the analysis provider")
                .register(registry);

        this.reviewsConflicted = Counter.builder("codeguardian.reviews.conflicted")
                .description("Triggers rejected because a review was already running")
                .register(registry);

        this.tokensTotal = Counter.builder("codeguardian.analysis.tokens")
                .description("Total tokens consumed by the analysis provider")
                .register(registry);

        this.analysisDuration = Timer.builder("codeguardian.analysis.duration")
                .description("Analysis provider call duration")
                .register(registry);

        this.fixesApplied = Counter.builder("codeguardian.fixes.applied")
                .description("Fixes applied, single or bulk")
                .register(registry);

        this.fixesSkipped = Counter.builder("codeguardian.fixes.skipped")
                .description("Bulk fix items skipped")
                .register(registry);

        this.fixesFailed = Counter.builder("codeguardian.fixes.failed")
                .description("Bulk fix items failed")
                .register(registry);
    }

    public void recordReviewTriggered() { reviewsTriggered.increment(); }
    public void recordReviewConflict() { reviewsConflicted.increment(); }
    public void recordReviewFailed() { reviewsFailed.increment(); }

    public void recordReviewCompleted(long durationMs, long tokens) {
        reviewsCompleted.increment();
        analysisDuration.record(Duration.ofMillis(durationMs));
        tokensTotal.increment(tokens);
    }

    public void recordFixesApplied(int count) { fixesApplied.increment(count); }

    public void recordBulkOutcome(int applied, int skipped, int failed) {
        fixesApplied.increment(applied);
        fixesSkipped.increment(skipped);
        fixesFailed.increment(failed);
    }
}
