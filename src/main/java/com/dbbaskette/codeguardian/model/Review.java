package com.dbbaskette.codeguardian.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "reviews", uniqueConstraints = @UniqueConstraint(
        name = "uk_reviews_active_pull_request", columnNames = {"active_pull_request_id"}))
public class Review {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "pull_request_id", nullable = false)
    private PullRequest pullRequest;

    // Holds the pull request id while PENDING/IN_PROGRESS, null once terminal.
    // The unique constraint on it allows at most one non-terminal review per pull request.
    @JsonIgnore
    @Column(name = "active_pull_request_id")
    private Long activePullRequestId;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_type", nullable = false)
    private ReviewType reviewType = ReviewType.FULL_REVIEW;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReviewStatus status = ReviewStatus.PENDING;

    @Column(name = "overall_score")
    private Double overallScore;

    @Column(name = "security_score")
    private Double securityScore;

    @Column(name = "performance_score")
    private Double performanceScore;

    @Column(name = "maintainability_score")
    private Double maintainabilityScore;

    @Lob
    @Column(name = "summary")
    private String summary;

    @Lob
    @Convert(converter = StringListConverter.class)
    @Column(name = "recommendations")
    private List<String> recommendations = new ArrayList<>();

    @Column(name = "model_used")
    private String modelUsed;

    @Column(name = "tokens_used")
    private Long tokensUsed;

    @Column(name = "estimated_cost", precision = 10, scale = 4)
    private BigDecimal estimatedCost;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public Review() {}

    public Review(PullRequest pullRequest, ReviewType reviewType, LocalDateTime createdAt) {
        this.pullRequest = pullRequest;
        this.reviewType = reviewType;
        this.createdAt = createdAt;
        this.activePullRequestId = pullRequest.getId();
    }

    /**
     * Moves the review along its lifecycle. Terminal states release the per-pull-request slot.
     *
     * @throws IllegalStateException if the transition is not allowed from the current status
     */
    public void transitionTo(ReviewStatus target, LocalDateTime at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Review " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
        if (target == ReviewStatus.IN_PROGRESS) {
            this.startedAt = at;
        }
        if (target.isTerminal()) {
            this.completedAt = at;
            this.activePullRequestId = null;
        }
    }

    // Getters and setters

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public PullRequest getPullRequest() { return pullRequest; }
    public void setPullRequest(PullRequest pullRequest) { this.pullRequest = pullRequest; }

    public Long getActivePullRequestId() { return activePullRequestId; }

    public ReviewType getReviewType() { return reviewType; }
    public void setReviewType(ReviewType reviewType) { this.reviewType = reviewType; }

    public ReviewStatus getStatus() { return status; }

    public Double getOverallScore() { return overallScore; }
    public void setOverallScore(Double overallScore) { this.overallScore = overallScore; }

    public Double getSecurityScore() { return securityScore; }
    public void setSecurityScore(Double securityScore) { this.securityScore = securityScore; }

    public Double getPerformanceScore() { return performanceScore; }
    public void setPerformanceScore(Double performanceScore) { this.performanceScore = performanceScore; }

    public Double getMaintainabilityScore() { return maintainabilityScore; }
    public void setMaintainabilityScore(Double maintainabilityScore) { this.maintainabilityScore = maintainabilityScore; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public List<String> getRecommendations() { return recommendations; }
    public void setRecommendations(List<String> recommendations) { this.recommendations = recommendations; }

    public String getModelUsed() { return modelUsed; }
    public void setModelUsed(String modelUsed) { this.modelUsed = modelUsed; }

    public Long getTokensUsed() { return tokensUsed; }
    public void setTokensUsed(Long tokensUsed) { this.tokensUsed = tokensUsed; }

    public BigDecimal getEstimatedCost() { return estimatedCost; }
    public void setEstimatedCost(BigDecimal estimatedCost) { this.estimatedCost = estimatedCost; }

    public Long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(Long processingTimeMs) { this.processingTimeMs = processingTimeMs; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getStartedAt() { return startedAt; }
    public LocalDateTime getCompletedAt() { return completedAt; }
}
