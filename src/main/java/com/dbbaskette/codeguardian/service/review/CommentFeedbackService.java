package com.dbbaskette.codeguardian.service.review;

import com.dbbaskette.codeguardian.model.CommentFeedback;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.dbbaskette.codeguardian.service.result.OperationResult;
import com.dbbaskette.codeguardian.service.store.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Records reviewer feedback on a comment. Only the feedback tag and resolution state change.
 */
@Service
public class CommentFeedbackService {

    private static final Logger log = LoggerFactory.getLogger(CommentFeedbackService.class);

    private final ReviewStore store;
    private final Clock clock;

    public CommentFeedbackService(ReviewStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public OperationResult<ReviewComment> recordFeedback(Long commentId, String feedback) {
        Optional<CommentFeedback> parsed = CommentFeedback.fromLabel(feedback);
        if (parsed.isEmpty()) {
            return OperationResult.validation(
                    "feedback must be one of helpful, not_helpful, applied", "feedback");
        }
        if (store.findCommentById(commentId).isEmpty()) {
            return OperationResult.notFound("Comment", commentId);
        }
        ReviewComment updated = store.updateCommentFeedback(commentId, parsed.get(), LocalDateTime.now(clock));
        log.info("Comment {} marked {}", commentId, parsed.get().getLabel());
        return OperationResult.success(updated);
    }
}
