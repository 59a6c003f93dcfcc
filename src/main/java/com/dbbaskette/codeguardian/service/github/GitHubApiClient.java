package com.dbbaskette.codeguardian.service.github;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;

@Service
public class GitHubApiClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    static final String DIFF_MEDIA_TYPE = "application/vnd.github.v3.diff";

    private final WebClient webClient;
    private final Duration timeout;

    public GitHubApiClient(WebClient gitHubWebClient, CodeGuardianProperties properties) {
        this.webClient = gitHubWebClient;
        this.timeout = Duration.ofSeconds(properties.getGithub().getTimeoutSeconds());
    }

    /**
     * Unified diff of a pull request, as GitHub renders it.
     */
    public String getPullRequestDiff(String owner, String repo, int prNumber) {
        log.debug("Getting diff for {}/{} #{}", owner, repo, prNumber);
        return webClient.get()
                .uri("/repos/{owner}/{repo}/pulls/{number}", owner, repo, prNumber)
                .header(HttpHeaders.ACCEPT, DIFF_MEDIA_TYPE)
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(retryOnServerError())
                .block(timeout);
    }

    /**
     * Lightweight reachability check used by the health indicator.
     */
    public boolean isReachable() {
        try {
            webClient.get()
                    .uri("/rate_limit")
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
            return true;
        } catch (Exception e) {
            log.debug("GitHub API not reachable: {}", e.getMessage());
            return false;
        }
    }

    private Retry retryOnServerError() {
        return Retry.backoff(2, Duration.ofSeconds(1))
                .filter(throwable -> {
                    if (throwable instanceof WebClientResponseException wcre) {
                        HttpStatusCode status = wcre.getStatusCode();
                        return status.is5xxServerError() || status.value() == 429;
                    }
                    return false;
                })
                .doBeforeRetry(signal -> log.warn("Retrying GitHub API call (attempt {}): {}",
                        signal.totalRetries() + 1, signal.failure().getMessage()));
    }
}
