package com.dbbaskette.codeguardian.observability;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import com.dbbaskette.codeguardian.service.github.GitHubApiClient;
import com.dbbaskette.codeguardian.service.store.ReviewStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("codeGuardian")
public class CodeGuardianHealthIndicator implements HealthIndicator {

    private final ReviewStore store;
    private final GitHubApiClient gitHubApiClient;
    private final CodeGuardianProperties properties;

    public CodeGuardianHealthIndicator(ReviewStore store, GitHubApiClient gitHubApiClient,
                                       CodeGuardianProperties properties) {
        this.store = store;
        this.gitHubApiClient = gitHubApiClient;
        this.properties = properties;
    }

    @Override
    public Health health() {
        Health.Builder builder = Health.up();

        builder.withDetail("activeReviews", store.countActiveReviews());
        builder.withDetail("analysisTimeoutSeconds", properties.getAnalysis().getTimeoutSeconds());
        builder.withDetail("analysisModel", properties.getAnalysis().getModel());

        // GitHub token configured
        String token = properties.getGithub().getToken();
        boolean tokenSet = token != null && !token.isBlank();
        builder.withDetail("githubToken", tokenSet ? "configured" : "missing");

        if (!tokenSet) {
            builder.status("DEGRADED");
            return builder.build();
        }

        boolean reachable = gitHubApiClient.isReachable();
        builder.withDetail("githubApi", reachable ? "reachable" : "unreachable");
        if (!reachable) {
            builder.status("DEGRADED");
        }
        return builder.build();
    }
}
