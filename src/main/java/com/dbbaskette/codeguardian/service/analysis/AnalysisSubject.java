package com.dbbaskette.codeguardian.service.analysis;

import com.dbbaskette.codeguardian.model.PullRequest;
import com.dbbaskette.codeguardian.model.ReviewType;

/**
 * What the analysis provider is asked to review.
 */
public record AnalysisSubject(
        String repoOwner,
        String repoName,
        int pullRequestNumber,
        String title,
        String description,
        ReviewType reviewType
) {
    public static AnalysisSubject of(PullRequest pullRequest, ReviewType reviewType) {
        return new AnalysisSubject(pullRequest.getRepoOwner(), pullRequest.getRepoName(),
                pullRequest.getNumber(), pullRequest.getTitle(), pullRequest.getDescription(), reviewType);
    }

    public String fullName() {
        return repoOwner + "/" + repoName;
    }
}
