package com.dbbaskette.codeguardian.service.fix;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.observability.CodeGuardianMetrics;
import com.dbbaskette.codeguardian.service.result.OperationResult;
import com.dbbaskette.codeguardian.service.store.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Applies a batch of fixes against one review. Items are processed independently on the
 * bulk worker pool; a failing item is reported, never rethrown.
 */
@Service
public class BulkFixApplier {

    private static final Logger log = LoggerFactory.getLogger(BulkFixApplier.class);

    static final String REASON_NOT_FOUND = "fix not found";
    static final String REASON_NOT_AUTO_APPLICABLE = "not auto-applicable";
    static final String REASON_CANCELLED = "cancelled";

    private final ReviewStore store;
    private final FixSuggestionEngine engine;
    private final Executor executor;
    private final CodeGuardianMetrics metrics;
    private final Clock clock;
    private final int maxBatchSize;

    public BulkFixApplier(ReviewStore store,
                          FixSuggestionEngine engine,
                          @Qualifier("bulkFixExecutor") Executor executor,
                          CodeGuardianMetrics metrics,
                          Clock clock,
                          CodeGuardianProperties properties) {
        this.store = store;
        this.engine = engine;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
        this.maxBatchSize = properties.getFixes().getMaxBatchSize();
    }

    public OperationResult<BulkFixResult> apply(Long reviewId, List<String> fixIds) {
        return apply(reviewId, fixIds, BulkCancellation.none());
    }

    public OperationResult<BulkFixResult> apply(Long reviewId, List<String> fixIds, BulkCancellation cancellation) {
        if (fixIds == null || fixIds.isEmpty()) {
            return OperationResult.validation("fix_ids must contain at least one fix id", "fix_ids");
        }
        if (fixIds.size() > maxBatchSize) {
            return OperationResult.validation("Batch of " + fixIds.size()
                    + " fix ids exceeds batch cap of " + maxBatchSize, "fix_ids");
        }
        if (store.findReview(reviewId).isEmpty()) {
            return OperationResult.notFound("Review", reviewId);
        }

        log.info("Bulk applying {} fixes on review {}", fixIds.size(), reviewId);
        // A repeated id is resolved once and reported at every position it was requested
        List<String> distinctIds = new ArrayList<>(new LinkedHashSet<>(fixIds));
        Accumulator accumulator = new Accumulator(distinctIds.size());
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        List<CompletableFuture<Void>> futures = new ArrayList<>(distinctIds.size());
        for (int i = 0; i < distinctIds.size(); i++) {
            int index = i;
            String fixId = distinctIds.get(i);
            Runnable task = () -> runItem(reviewId, index, fixId, cancellation, accumulator, mdc);
            try {
                futures.add(CompletableFuture.runAsync(task, executor));
            } catch (RejectedExecutionException e) {
                // Pool saturated: run on the caller thread
                log.debug("Bulk worker pool saturated, running {} inline", fixId);
                task.run();
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        BulkFixResult result = accumulator.build(distinctIds, fixIds);
        BulkFixResult.Summary summary = result.summary();
        metrics.recordBulkOutcome(summary.applied(), summary.skipped(), summary.failed());
        log.info("Bulk apply on review {} done: total={}, applied={}, skipped={}, failed={}",
                reviewId, summary.total(), summary.applied(), summary.skipped(), summary.failed());
        return OperationResult.success(result);
    }

    private void runItem(Long reviewId, int index, String fixId, BulkCancellation cancellation,
                         Accumulator accumulator, Map<String, String> mdc) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            if (cancellation.isCancelled()) {
                accumulator.skip(index, REASON_CANCELLED);
                return;
            }
            processItem(reviewId, index, fixId, accumulator);
        } catch (Exception e) {
            log.warn("Failed to apply fix {} on review {}: {}", fixId, reviewId, e.getMessage());
            accumulator.fail(index, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private void processItem(Long reviewId, int index, String fixId, Accumulator accumulator) {
        long commentId = FixIds.parse(fixId);
        Optional<ReviewComment> comment = store.findComment(reviewId, commentId);
        if (comment.isEmpty()) {
            accumulator.skip(index, REASON_NOT_FOUND);
            return;
        }
        Optional<FixSuggestion> fix = engine.suggest(comment.get());
        if (fix.isEmpty() || !fix.get().autoApplicable()) {
            accumulator.skip(index, REASON_NOT_AUTO_APPLICABLE);
            return;
        }
        accumulator.apply(index, LocalDateTime.now(clock));
    }

    /**
     * Collects per-item outcomes by distinct fix id. The first outcome for a slot wins.
     */
    private static final class Accumulator {

        private enum Kind { APPLIED, FAILED, SKIPPED }

        private record Outcome(Kind kind, String reason, LocalDateTime appliedAt) {}

        private final Outcome[] outcomes;

        Accumulator(int size) {
            this.outcomes = new Outcome[size];
        }

        synchronized void apply(int index, LocalDateTime at) {
            record(index, new Outcome(Kind.APPLIED, null, at));
        }

        synchronized void fail(int index, String reason) {
            record(index, new Outcome(Kind.FAILED, reason, null));
        }

        synchronized void skip(int index, String reason) {
            record(index, new Outcome(Kind.SKIPPED, reason, null));
        }

        private void record(int index, Outcome outcome) {
            if (outcomes[index] == null) {
                outcomes[index] = outcome;
            }
        }

        /**
         * @param distinctIds the slot order outcomes were recorded in
         * @param requested   the ids as requested, duplicates included; one result item per entry
         */
        synchronized BulkFixResult build(List<String> distinctIds, List<String> requested) {
            Map<String, Integer> slots = new HashMap<>();
            for (int i = 0; i < distinctIds.size(); i++) {
                slots.put(distinctIds.get(i), i);
            }
            List<BulkFixResult.AppliedItem> applied = new ArrayList<>();
            List<BulkFixResult.RejectedItem> failed = new ArrayList<>();
            List<BulkFixResult.RejectedItem> skipped = new ArrayList<>();
            for (String fixId : requested) {
                Outcome outcome = outcomes[slots.get(fixId)];
                if (outcome == null) {
                    failed.add(new BulkFixResult.RejectedItem(fixId, "no outcome recorded"));
                    continue;
                }
                switch (outcome.kind()) {
                    case APPLIED -> applied.add(new BulkFixResult.AppliedItem(fixId, outcome.appliedAt()));
                    case FAILED -> failed.add(new BulkFixResult.RejectedItem(fixId, outcome.reason()));
                    case SKIPPED -> skipped.add(new BulkFixResult.RejectedItem(fixId, outcome.reason()));
                }
            }
            return new BulkFixResult(applied, failed, skipped);
        }
    }
}
