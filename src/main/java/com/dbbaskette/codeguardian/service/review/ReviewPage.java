package com.dbbaskette.codeguardian.service.review;

import com.dbbaskette.codeguardian.model.Review;

import java.util.List;

public record ReviewPage(List<Review> reviews, long total, int limit, int offset) {}
