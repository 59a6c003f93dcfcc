package com.dbbaskette.codeguardian.service.analysis;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import com.dbbaskette.codeguardian.security.LogSanitizer;
import com.dbbaskette.codeguardian.service.github.GitHubApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.stereotype.Service;

/**
 * Reviews a pull request by sending its diff to the configured chat model.
 */
@Service
public class ChatAnalysisProvider implements AnalysisProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatAnalysisProvider.class);

    private final ChatClient.Builder chatClientBuilder;
    private final GitHubApiClient gitHubApiClient;
    private final AnalysisPromptBuilder promptBuilder;
    private final AnalysisReportParser reportParser;
    private final CodeGuardianProperties properties;

    public ChatAnalysisProvider(ChatClient.Builder chatClientBuilder,
                                GitHubApiClient gitHubApiClient,
                                AnalysisPromptBuilder promptBuilder,
                                AnalysisReportParser reportParser,
                                CodeGuardianProperties properties) {
        this.chatClientBuilder = chatClientBuilder;
        this.gitHubApiClient = gitHubApiClient;
        this.promptBuilder = promptBuilder;
        this.reportParser = reportParser;
        this.properties = properties;
    }

    @Override
    public AnalysisReport analyze(AnalysisSubject subject) throws AnalysisProviderException {
        log.info("Requesting {} analysis for {} PR #{}", subject.reviewType().getLabel(),
                subject.fullName(), subject.pullRequestNumber());

        String diff = fetchDiff(subject);
        String prompt = promptBuilder.buildReviewPrompt(subject, diff,
                properties.getAnalysis().getMaxDiffChars());

        ChatResponse response;
        try {
            response = chatClientBuilder.build()
                    .prompt()
                    .system(AnalysisPromptBuilder.SYSTEM_PROMPT)
                    .user(prompt)
                    .call()
                    .chatResponse();
        } catch (Exception e) {
            throw new AnalysisProviderException("Chat model call failed: "
                    + LogSanitizer.sanitize(e.getMessage()), e);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new AnalysisProviderException("Chat model returned no result");
        }

        String modelUsed = properties.getAnalysis().getModel();
        Long tokensUsed = null;
        ChatResponseMetadata metadata = response.getMetadata();
        if (metadata != null) {
            if (metadata.getModel() != null && !metadata.getModel().isBlank()) {
                modelUsed = metadata.getModel();
            }
            Usage usage = metadata.getUsage();
            if (usage != null && usage.getTotalTokens() != null) {
                tokensUsed = usage.getTotalTokens().longValue();
            }
        }

        return reportParser.parse(response.getResult().getOutput().getText(), modelUsed, tokensUsed);
    }

    @Override
    public String name() {
        return "chat-model";
    }

    private String fetchDiff(AnalysisSubject subject) {
        try {
            return gitHubApiClient.getPullRequestDiff(subject.repoOwner(), subject.repoName(),
                    subject.pullRequestNumber());
        } catch (Exception e) {
            log.warn("Could not fetch diff for {} PR #{}, reviewing without it: {}",
                    subject.fullName(), subject.pullRequestNumber(), LogSanitizer.sanitize(e.getMessage()));
            return null;
        }
    }
}
