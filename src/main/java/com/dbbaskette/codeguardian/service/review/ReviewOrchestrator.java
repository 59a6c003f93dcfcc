package com.dbbaskette.codeguardian.service.review;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import com.dbbaskette.codeguardian.model.PullRequest;
import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewCategory;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.model.ReviewType;
import com.dbbaskette.codeguardian.model.Severity;
import com.dbbaskette.codeguardian.observability.CodeGuardianMetrics;
import com.dbbaskette.codeguardian.security.LogSanitizer;
import com.dbbaskette.codeguardian.service.analysis.AnalysisProvider;
import com.dbbaskette.codeguardian.service.analysis.AnalysisProviderException;
import com.dbbaskette.codeguardian.service.analysis.AnalysisReport;
import com.dbbaskette.codeguardian.service.analysis.AnalysisSubject;
import com.dbbaskette.codeguardian.service.result.OperationResult;
import com.dbbaskette.codeguardian.service.store.ReviewOutcome;
import com.dbbaskette.codeguardian.service.store.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a review from trigger to COMPLETED or FAILED:
 * open (PENDING then IN_PROGRESS, committed) - analyze under a timeout - persist outcome and
 * comments together, or mark the review failed.
 */
@Service
public class ReviewOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);

    static final String PROVIDER_SERVICE = "analysis-provider";
    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);

    private final ReviewStore store;
    private final AnalysisProvider provider;
    private final Executor analysisExecutor;
    private final CodeGuardianProperties properties;
    private final CodeGuardianMetrics metrics;
    private final Clock clock;

    public ReviewOrchestrator(ReviewStore store,
                              AnalysisProvider provider,
                              @Qualifier("analysisExecutor") Executor analysisExecutor,
                              CodeGuardianProperties properties,
                              CodeGuardianMetrics metrics,
                              Clock clock) {
        this.store = store;
        this.provider = provider;
        this.analysisExecutor = analysisExecutor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public OperationResult<ReviewDetails> trigger(Long pullRequestId, String reviewType) {
        if (pullRequestId == null || pullRequestId <= 0) {
            return OperationResult.validation("pull_request_id must be a positive number", "pull_request_id");
        }
        Optional<ReviewType> type = ReviewType.fromLabel(reviewType);
        if (type.isEmpty()) {
            return OperationResult.validation("Unsupported review_type: " + reviewType, "review_type");
        }
        Optional<PullRequest> pullRequest = store.findPullRequest(pullRequestId);
        if (pullRequest.isEmpty()) {
            return OperationResult.notFound("Pull request", pullRequestId);
        }
        return trigger(pullRequest.get(), type.get());
    }

    public OperationResult<ReviewDetails> trigger(PullRequest pullRequest, ReviewType reviewType) {
        Optional<Review> opened = store.openReview(pullRequest, reviewType, LocalDateTime.now(clock));
        if (opened.isEmpty()) {
            metrics.recordReviewConflict();
            log.info("Review trigger rejected for {} PR #{}: a review is already in progress",
                    pullRequest.fullName(), pullRequest.getNumber());
            return OperationResult.conflict("Pull request " + pullRequest.getId()
                    + " already has a review in progress");
        }
        Review review = opened.get();
        metrics.recordReviewTriggered();
        log.info("Review {} started for {} PR #{} ({})", review.getId(), pullRequest.fullName(),
                pullRequest.getNumber(), reviewType.getLabel());

        AnalysisReport report;
        try {
            report = analyze(AnalysisSubject.of(pullRequest, reviewType));
        } catch (AnalysisProviderException e) {
            return fail(review, e.getMessage());
        }

        return complete(review, report);
    }

    private AnalysisReport analyze(AnalysisSubject subject) throws AnalysisProviderException {
        int timeoutSeconds = properties.getAnalysis().getTimeoutSeconds();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        CompletableFuture<AnalysisReport> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return provider.analyze(subject);
                } catch (AnalysisProviderException e) {
                    throw new CompletionException(e);
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            }, analysisExecutor);
        } catch (RejectedExecutionException e) {
            throw new AnalysisProviderException("Analysis capacity exhausted, try again later", e);
        }

        try {
            AnalysisReport report = future.get(timeoutSeconds, TimeUnit.SECONDS);
            if (report == null) {
                throw new AnalysisProviderException(provider.name() + " returned no report");
            }
            return report;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AnalysisProviderException("Analysis timed out after " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            String message = cause != null && cause.getMessage() != null
                    ? cause.getMessage() : String.valueOf(cause);
            throw new AnalysisProviderException(message, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AnalysisProviderException("Analysis interrupted", e);
        }
    }

    private OperationResult<ReviewDetails> fail(Review review, String reason) {
        String sanitized = LogSanitizer.sanitizeReason(reason);
        log.error("Review {} failed: {}", review.getId(), sanitized);
        try {
            store.failReview(review.getId(), sanitized, LocalDateTime.now(clock));
        } catch (RuntimeException e) {
            log.error("Could not mark review {} as failed", review.getId(), e);
            return OperationResult.internal("Failed to record review failure");
        }
        metrics.recordReviewFailed();
        return OperationResult.externalService(PROVIDER_SERVICE, "Analysis provider failed: " + sanitized);
    }

    private OperationResult<ReviewDetails> complete(Review review, AnalysisReport report) {
        LocalDateTime now = LocalDateTime.now(clock);
        long processingTimeMs = review.getStartedAt() != null
                ? Math.max(0, Duration.between(review.getStartedAt(), now).toMillis()) : 0;
        ReviewOutcome outcome = toOutcome(report, processingTimeMs);
        List<ReviewComment> comments = toComments(review.getId(), report.comments(), now);

        Review completed;
        try {
            completed = store.completeReview(review.getId(), outcome, comments, now);
        } catch (RuntimeException e) {
            log.error("Failed to persist analysis for review {}", review.getId(), e);
            try {
                store.failReview(review.getId(), "Failed to persist analysis result", LocalDateTime.now(clock));
                metrics.recordReviewFailed();
            } catch (RuntimeException inner) {
                log.error("Could not mark review {} as failed", review.getId(), inner);
            }
            return OperationResult.internal("Failed to persist review");
        }

        metrics.recordReviewCompleted(processingTimeMs, outcome.tokensUsed());
        log.info("Review {} completed: overall={}, comments={}, tokens={}, {}ms", completed.getId(),
                outcome.overallScore(), comments.size(), outcome.tokensUsed(), processingTimeMs);
        return OperationResult.success(new ReviewDetails(completed, store.findComments(completed.getId())));
    }

    ReviewOutcome toOutcome(AnalysisReport report, long processingTimeMs) {
        CodeGuardianProperties.FallbackConfig fallback = properties.getReview().getFallback();
        long tokens = report.tokensUsed() != null && report.tokensUsed() > 0 ? report.tokensUsed() : 0L;
        String model = report.modelUsed() != null && !report.modelUsed().isBlank()
                ? report.modelUsed() : properties.getAnalysis().getModel();
        String summary = report.summary() != null && !report.summary().isBlank()
                ? report.summary() : fallback.getSummary();

        return new ReviewOutcome(
                score(report.overallScore(), fallback.getOverallScore()),
                score(report.securityScore(), fallback.getSecurityScore()),
                score(report.performanceScore(), fallback.getPerformanceScore()),
                score(report.maintainabilityScore(), fallback.getMaintainabilityScore()),
                summary,
                report.recommendations(),
                model,
                tokens,
                estimateCost(tokens),
                processingTimeMs
        );
    }

    List<ReviewComment> toComments(Long reviewId, List<AnalysisReport.ReportedComment> reported,
                                   LocalDateTime now) {
        List<ReviewComment> comments = new ArrayList<>(reported.size());
        for (int i = 0; i < reported.size(); i++) {
            AnalysisReport.ReportedComment item = reported.get(i);
            ReviewComment comment = new ReviewComment(reviewId, i, now);
            comment.setFilePath(item.filePath() != null ? item.filePath() : "");
            comment.setLineNumber(item.lineNumber() != null && item.lineNumber() > 0 ? item.lineNumber() : null);
            comment.setCommentType(item.type() != null && !item.type().isBlank() ? item.type() : "suggestion");
            comment.setSeverity(Severity.fromLabel(item.severity()));
            comment.setCategory(ReviewCategory.fromLabel(item.category()));
            comment.setTitle(item.title() != null ? item.title() : "");
            comment.setMessage(item.message() != null ? item.message() : "");
            comment.setSuggestedFix(item.suggestedFix());
            comment.setOriginalCode(item.originalCode());
            comment.setSuggestedCode(item.suggestedCode());
            comments.add(comment);
        }
        return comments;
    }

    private static double score(Double value, double fallback) {
        if (value == null || value.isNaN() || value.isInfinite() || value < 0 || value > 100) {
            return fallback;
        }
        return value;
    }

    private BigDecimal estimateCost(long tokens) {
        return BigDecimal.valueOf(tokens)
                .multiply(properties.getAnalysis().getCostPerMillionTokens())
                .divide(ONE_MILLION, 4, RoundingMode.HALF_UP);
    }
}
