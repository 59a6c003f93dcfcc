package com.dbbaskette.codeguardian.service.fix;

import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.observability.CodeGuardianMetrics;
import com.dbbaskette.codeguardian.service.result.OperationResult;
import com.dbbaskette.codeguardian.service.store.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Fix listing, preview and single apply for a stored review.
 */
@Service
public class FixService {

    private static final Logger log = LoggerFactory.getLogger(FixService.class);

    private final ReviewStore store;
    private final FixSuggestionEngine engine;
    private final DiffComputer diffComputer;
    private final CodeGuardianMetrics metrics;
    private final Clock clock;

    public FixService(ReviewStore store, FixSuggestionEngine engine, DiffComputer diffComputer,
                      CodeGuardianMetrics metrics, Clock clock) {
        this.store = store;
        this.engine = engine;
        this.diffComputer = diffComputer;
        this.metrics = metrics;
        this.clock = clock;
    }

    public OperationResult<ReviewFixes> listFixes(Long reviewId) {
        if (store.findReview(reviewId).isEmpty()) {
            return OperationResult.notFound("Review", reviewId);
        }
        return OperationResult.success(
                ReviewFixes.forReview(reviewId, engine.suggestAll(store.findComments(reviewId))));
    }

    public OperationResult<AppliedFix> applyFix(Long reviewId, String fixId) {
        return resolve(reviewId, fixId).flatMap(fix -> {
            if (!fix.autoApplicable()) {
                return OperationResult.validation("Fix " + fixId + " is not auto-applicable", "fix_id");
            }
            AppliedFix applied = new AppliedFix(fix.id(), true, fix.originalCode(), fix.suggestedFix(),
                    diffComputer.unifiedDiff(fix.originalCode(), fix.suggestedFix()),
                    LocalDateTime.now(clock));
            metrics.recordFixesApplied(1);
            log.info("Applied fix {} on review {}", fixId, reviewId);
            return OperationResult.success(applied);
        });
    }

    public OperationResult<FixPreview> previewFix(Long reviewId, String fixId) {
        return resolve(reviewId, fixId).map(fix -> {
            DiffComputer.DiffResult diff = diffComputer.compute(fix.originalCode(), fix.suggestedFix());
            return new FixPreview(fix.id(), fix.originalCode(), fix.suggestedFix(), diff.lines(),
                    diff.stats(), fix.explanation(), fix.confidence(), fix.autoApplicable());
        });
    }

    private OperationResult<FixSuggestion> resolve(Long reviewId, String fixId) {
        if (fixId == null || fixId.isBlank()) {
            return OperationResult.validation("fix_id is required", "fix_id");
        }
        if (store.findReview(reviewId).isEmpty()) {
            return OperationResult.notFound("Review", reviewId);
        }
        Optional<ReviewComment> comment = FixIds.tryParse(fixId)
                .flatMap(commentId -> store.findComment(reviewId, commentId));
        if (comment.isEmpty()) {
            return OperationResult.notFound("Fix", fixId);
        }
        return engine.suggest(comment.get())
                .map(OperationResult::success)
                .orElseGet(() -> OperationResult.notFound("Fix suggestion", fixId));
    }
}
