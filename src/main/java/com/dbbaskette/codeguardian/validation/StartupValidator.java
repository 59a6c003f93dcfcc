package com.dbbaskette.codeguardian.validation;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class StartupValidator {

    private static final Logger log = LoggerFactory.getLogger(StartupValidator.class);

    static final String ANTHROPIC_KEY_PROPERTY = "spring.ai.anthropic.api-key";

    private final CodeGuardianProperties properties;
    private final Environment environment;

    public StartupValidator(CodeGuardianProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validate() {
        log.info("=== CodeGuardian Startup Validation ===");

        validateAnalysisProvider();
        validateGitHubToken();
        validateFixSettings();

        log.info("=== Startup Validation Complete ===");
    }

    private void validateAnalysisProvider() {
        String apiKey = environment.getProperty(ANTHROPIC_KEY_PROPERTY);
        if (apiKey != null && !apiKey.isBlank()) {
            log.info("[OK] Analysis model API key configured (model {})", properties.getAnalysis().getModel());
        } else {
            log.warn("[WARN] Analysis model API key not configured. Set ANTHROPIC_API_KEY environment variable.");
        }
        log.info("[OK] Analysis timeout {}s, up to {} concurrent analyses",
                properties.getAnalysis().getTimeoutSeconds(), properties.getAnalysis().getMaxConcurrentAnalyses());
    }

    private void validateGitHubToken() {
        String token = properties.getGithub().getToken();
        if (token != null && !token.isBlank()) {
            log.info("[OK] GitHub token configured");
        } else {
            log.warn("[WARN] GitHub token not configured. Private pull request diffs will not be available.");
        }
    }

    private void validateFixSettings() {
        if (properties.getFixes().getMaxBatchSize() > 50) {
            log.warn("[WARN] Bulk fix batch cap raised to {}", properties.getFixes().getMaxBatchSize());
        } else {
            log.info("[OK] Bulk fix batch cap {}", properties.getFixes().getMaxBatchSize());
        }
    }
}
