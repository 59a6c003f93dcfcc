package com.dbbaskette.codeguardian.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * One finding of a completed review. Only the resolution state and feedback tag change after creation.
 */
@Entity
@Table(name = "review_comments", indexes = @Index(name = "idx_review_comments_review", columnList = "review_id, display_order"))
public class ReviewComment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "review_id", nullable = false, updatable = false)
    private Long reviewId;

    // Index of the finding in the provider response
    @Column(name = "display_order", nullable = false, updatable = false)
    private int position;

    @Column(name = "file_path", nullable = false, length = 500)
    private String filePath = "";

    @Column(name = "line_number")
    private Integer lineNumber;

    @Column(name = "comment_type", nullable = false, length = 50)
    private String commentType = "suggestion";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity = Severity.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private ReviewCategory category = ReviewCategory.GENERAL;

    @Column(nullable = false, length = 200)
    private String title = "";

    @Lob
    @Column(nullable = false)
    private String message = "";

    @Lob
    @Column(name = "suggested_fix")
    private String suggestedFix;

    @Lob
    @Column(name = "original_code")
    private String originalCode;

    @Lob
    @Column(name = "suggested_code")
    private String suggestedCode;

    @Column(name = "is_resolved", nullable = false)
    private boolean resolved = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_feedback", length = 20)
    private CommentFeedback userFeedback;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public ReviewComment() {}

    public ReviewComment(Long reviewId, int position, LocalDateTime createdAt) {
        this.reviewId = reviewId;
        this.position = position;
        this.createdAt = createdAt;
    }

    /**
     * Records user feedback; "applied" also resolves the comment.
     */
    public void recordFeedback(CommentFeedback feedback, LocalDateTime at) {
        this.userFeedback = feedback;
        if (feedback == CommentFeedback.APPLIED && !resolved) {
            this.resolved = true;
            this.resolvedAt = at;
        }
    }

    public boolean hasSuggestion() {
        return suggestedFix != null && !suggestedFix.isBlank();
    }

    // Getters and setters

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getReviewId() { return reviewId; }

    public int getPosition() { return position; }

    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }

    public Integer getLineNumber() { return lineNumber; }
    public void setLineNumber(Integer lineNumber) { this.lineNumber = lineNumber; }

    public String getCommentType() { return commentType; }
    public void setCommentType(String commentType) { this.commentType = commentType; }

    public Severity getSeverity() { return severity; }
    public void setSeverity(Severity severity) { this.severity = severity; }

    public ReviewCategory getCategory() { return category; }
    public void setCategory(ReviewCategory category) { this.category = category; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getSuggestedFix() { return suggestedFix; }
    public void setSuggestedFix(String suggestedFix) { this.suggestedFix = suggestedFix; }

    public String getOriginalCode() { return originalCode; }
    public void setOriginalCode(String originalCode) { this.originalCode = originalCode; }

    public String getSuggestedCode() { return suggestedCode; }
    public void setSuggestedCode(String suggestedCode) { this.suggestedCode = suggestedCode; }

    public boolean isResolved() { return resolved; }

    public CommentFeedback getUserFeedback() { return userFeedback; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getResolvedAt() { return resolvedAt; }
}
