package com.dbbaskette.codeguardian.service.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the chat model's answer into an {@link AnalysisReport}. Missing fields stay null.
 */
@Component
public class AnalysisReportParser {

    private static final Logger log = LoggerFactory.getLogger(AnalysisReportParser.class);

    private final ObjectMapper objectMapper;

    public AnalysisReportParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws AnalysisProviderException if the output is empty or holds no JSON object
     */
    public AnalysisReport parse(String output, String modelUsed, Long tokensUsed) throws AnalysisProviderException {
        if (output == null || output.isBlank()) {
            throw new AnalysisProviderException("Empty analysis output");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(output));
        } catch (Exception e) {
            throw new AnalysisProviderException("Failed to parse analysis output: " + e.getMessage()
                    + " - raw: " + output.substring(0, Math.min(200, output.length())), e);
        }
        if (root == null || !root.isObject()) {
            throw new AnalysisProviderException("Analysis output is not a JSON object");
        }

        List<String> recommendations = new ArrayList<>();
        JsonNode recommendationsNode = root.path("recommendations");
        if (recommendationsNode.isArray()) {
            for (JsonNode r : recommendationsNode) {
                if (r.isTextual() && !r.asText().isBlank()) {
                    recommendations.add(r.asText());
                }
            }
        }

        List<AnalysisReport.ReportedComment> comments = new ArrayList<>();
        JsonNode commentsNode = root.path("comments");
        if (commentsNode.isArray()) {
            for (JsonNode c : commentsNode) {
                comments.add(new AnalysisReport.ReportedComment(
                        text(c, "file_path"),
                        c.path("line_number").canConvertToInt() ? c.path("line_number").asInt() : null,
                        text(c, "type"),
                        text(c, "severity"),
                        text(c, "category"),
                        text(c, "title"),
                        text(c, "message"),
                        text(c, "suggested_fix"),
                        text(c, "original_code"),
                        text(c, "suggested_code")
                ));
            }
        }

        AnalysisReport report = new AnalysisReport(
                number(root, "overall_score"),
                number(root, "security_score"),
                number(root, "performance_score"),
                number(root, "maintainability_score"),
                text(root, "summary"),
                recommendations,
                comments,
                root.hasNonNull("model_used") ? root.get("model_used").asText() : modelUsed,
                root.path("tokens_used").canConvertToLong() ? Long.valueOf(root.path("tokens_used").asLong()) : tokensUsed
        );

        log.info("Analysis parsed: scores=[overall={}, security={}, performance={}, maintainability={}], comments={}",
                report.overallScore(), report.securityScore(), report.performanceScore(),
                report.maintainabilityScore(), comments.size());
        return report;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    /**
     * Extract JSON object from output that may contain surrounding text.
     */
    String extractJson(String output) {
        String trimmed = output.trim();

        if (trimmed.startsWith("{")) {
            int lastBrace = trimmed.lastIndexOf('}');
            if (lastBrace > 0) {
                return trimmed.substring(0, lastBrace + 1);
            }
        }

        int fenceStart = trimmed.indexOf("```json");
        if (fenceStart >= 0) {
            int jsonStart = trimmed.indexOf('\n', fenceStart) + 1;
            int fenceEnd = trimmed.indexOf("```", jsonStart);
            if (fenceEnd > jsonStart) {
                return trimmed.substring(jsonStart, fenceEnd).trim();
            }
        }

        int braceStart = trimmed.indexOf('{');
        int braceEnd = trimmed.lastIndexOf('}');
        if (braceStart >= 0 && braceEnd > braceStart) {
            return trimmed.substring(braceStart, braceEnd + 1);
        }

        return trimmed;
    }
}
