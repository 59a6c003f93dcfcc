package com.dbbaskette.codeguardian.service.review;

import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewComment;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;

/**
 * A review together with its comments in provider order.
 */
public record ReviewDetails(@JsonUnwrapped Review review, List<ReviewComment> comments) {

    public ReviewDetails {
        comments = List.copyOf(comments);
    }
}
