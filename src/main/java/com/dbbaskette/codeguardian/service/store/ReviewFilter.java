package com.dbbaskette.codeguardian.service.store;

import com.dbbaskette.codeguardian.model.ReviewStatus;

/**
 * Listing criteria; null status or pull request id means "any".
 */
public record ReviewFilter(ReviewStatus status, Long pullRequestId, int offset, int limit) {}
