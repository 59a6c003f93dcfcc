package com.dbbaskette.codeguardian.controller;

import com.dbbaskette.codeguardian.controller.dto.FeedbackRequest;
import com.dbbaskette.codeguardian.controller.dto.TriggerReviewRequest;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.service.review.CommentFeedbackService;
import com.dbbaskette.codeguardian.service.review.ReviewDetails;
import com.dbbaskette.codeguardian.service.review.ReviewOrchestrator;
import com.dbbaskette.codeguardian.service.review.ReviewPage;
import com.dbbaskette.codeguardian.service.review.ReviewQueryService;
import com.dbbaskette.codeguardian.service.review.ReviewStats;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    private final ReviewOrchestrator orchestrator;
    private final ReviewQueryService queryService;
    private final CommentFeedbackService feedbackService;

    public ReviewController(ReviewOrchestrator orchestrator,
                            ReviewQueryService queryService,
                            CommentFeedbackService feedbackService) {
        this.orchestrator = orchestrator;
        this.queryService = queryService;
        this.feedbackService = feedbackService;
    }

    @PostMapping("/trigger")
    public ResponseEntity<ApiResponse<ReviewDetails>> trigger(@Valid @RequestBody TriggerReviewRequest request) {
        return ApiResponses.from(orchestrator.trigger(request.pullRequestId(), request.reviewType()),
                HttpStatus.CREATED, details -> "Review completed with " + details.comments().size() + " comments");
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ReviewDetails>> get(@PathVariable Long id) {
        return ApiResponses.from(queryService.getReview(id), "Review retrieved");
    }

    @GetMapping
    public ResponseEntity<ApiResponse<ReviewPage>> list(
            @RequestParam(required = false) String status,
            @RequestParam(name = "pull_request_id", required = false) Long pullRequestId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ApiResponses.from(queryService.listReviews(status, pullRequestId, limit, offset),
                HttpStatus.OK, page -> "Found " + page.total() + " reviews");
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<ReviewStats>> stats(@RequestParam(required = false) Integer days) {
        return ApiResponses.from(queryService.stats(days), "Review statistics");
    }

    @PostMapping("/comments/{id}/feedback")
    public ResponseEntity<ApiResponse<ReviewComment>> feedback(@PathVariable Long id,
                                                               @Valid @RequestBody FeedbackRequest request) {
        return ApiResponses.from(feedbackService.recordFeedback(id, request.feedback()), "Feedback recorded");
    }
}
