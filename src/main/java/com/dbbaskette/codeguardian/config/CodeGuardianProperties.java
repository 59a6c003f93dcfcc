package com.dbbaskette.codeguardian.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import java.math.BigDecimal;

@ConfigurationProperties(prefix = "codeguardian")
@Validated
public class CodeGuardianProperties {

    @Valid
    private AnalysisConfig analysis = new AnalysisConfig();

    @Valid
    private ReviewConfig review = new ReviewConfig();

    @Valid
    private FixesConfig fixes = new FixesConfig();

    @Valid
    private AdHocConfig adhoc = new AdHocConfig();

    @Valid
    private GitHubConfig github = new GitHubConfig();

    // Getters and setters

    public AnalysisConfig getAnalysis() { return analysis; }
    public void setAnalysis(AnalysisConfig analysis) { this.analysis = analysis; }

    public ReviewConfig getReview() { return review; }
    public void setReview(ReviewConfig review) { this.review = review; }

    public FixesConfig getFixes() { return fixes; }
    public void setFixes(FixesConfig fixes) { this.fixes = fixes; }

    public AdHocConfig getAdhoc() { return adhoc; }
    public void setAdhoc(AdHocConfig adhoc) { this.adhoc = adhoc; }

    public GitHubConfig getGithub() { return github; }
    public void setGithub(GitHubConfig github) { this.github = github; }

    public static class AnalysisConfig {
        @Min(1)
        private int timeoutSeconds = 60;
        @NotBlank
        private String model = "claude-sonnet-4-5";
        @NotNull
        private BigDecimal costPerMillionTokens = new BigDecimal("9.0");
        @Min(1000)
        private int maxDiffChars = 15000;
        @Min(1)
        private int maxConcurrentAnalyses = 4;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public BigDecimal getCostPerMillionTokens() { return costPerMillionTokens; }
        public void setCostPerMillionTokens(BigDecimal v) { this.costPerMillionTokens = v; }
        public int getMaxDiffChars() { return maxDiffChars; }
        public void setMaxDiffChars(int maxDiffChars) { this.maxDiffChars = maxDiffChars; }
        public int getMaxConcurrentAnalyses() { return maxConcurrentAnalyses; }
        public void setMaxConcurrentAnalyses(int v) { this.maxConcurrentAnalyses = v; }
    }

    public static class ReviewConfig {
        @Valid
        private FallbackConfig fallback = new FallbackConfig();

        public FallbackConfig getFallback() { return fallback; }
        public void setFallback(FallbackConfig fallback) { this.fallback = fallback; }
    }

    /**
     * Values used when the analysis provider leaves a field out.
     */
    public static class FallbackConfig {
        @DecimalMin("0") @DecimalMax("100")
        private double overallScore = 85.0;
        @DecimalMin("0") @DecimalMax("100")
        private double securityScore = 90.0;
        @DecimalMin("0") @DecimalMax("100")
        private double performanceScore = 80.0;
        @DecimalMin("0") @DecimalMax("100")
        private double maintainabilityScore = 88.0;
        @NotNull
        private String summary = "AI analysis completed successfully";

        public double getOverallScore() { return overallScore; }
        public void setOverallScore(double v) { this.overallScore = v; }
        public double getSecurityScore() { return securityScore; }
        public void setSecurityScore(double v) { this.securityScore = v; }
        public double getPerformanceScore() { return performanceScore; }
        public void setPerformanceScore(double v) { this.performanceScore = v; }
        public double getMaintainabilityScore() { return maintainabilityScore; }
        public void setMaintainabilityScore(double v) { this.maintainabilityScore = v; }
        public String getSummary() { return summary; }
        public void setSummary(String summary) { this.summary = summary; }
    }

    public static class FixesConfig {
        @DecimalMin("0") @DecimalMax("1")
        private double confidence = 0.85;
        @Min(1)
        private int maxBatchSize = 50;
        @Min(1)
        private int bulkWorkers = 4;

        public double getConfidence() { return confidence; }
        public void setConfidence(double confidence) { this.confidence = confidence; }
        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }
        public int getBulkWorkers() { return bulkWorkers; }
        public void setBulkWorkers(int bulkWorkers) { this.bulkWorkers = bulkWorkers; }
    }

    public static class AdHocConfig {
        @Min(1)
        private int minCodeChars = 10;
        @Min(1)
        private int maxCodeBytes = 1_000_000;

        public int getMinCodeChars() { return minCodeChars; }
        public void setMinCodeChars(int minCodeChars) { this.minCodeChars = minCodeChars; }
        public int getMaxCodeBytes() { return maxCodeBytes; }
        public void setMaxCodeBytes(int maxCodeBytes) { this.maxCodeBytes = maxCodeBytes; }
    }

    public static class GitHubConfig {
        private String apiUrl = "https://api.github.com";
        private String token;
        @Min(1) @Max(120)
        private int timeoutSeconds = 15;

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
