package com.dbbaskette.codeguardian.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisReportParserTest {

    private final AnalysisReportParser parser = new AnalysisReportParser(new ObjectMapper());

    @Test
    void parse_fullReport() throws Exception {
        String output = """
                {"overall_score": 78, "security_score": 62.5, "performance_score": 85,
                 "maintainability_score": 80, "summary": "Solid change with one injection risk",
                 "recommendations": ["Use bound parameters", ""],
                 "comments": [
                   {"file_path": "db/users.py", "line_number": 14, "type": "error", "severity": "critical",
                    "category": "security", "title": "SQL injection", "message": "Query built from input",
                    "suggested_fix": "Use placeholders", "original_code": "q = f'...'", "suggested_code": "q = '?'"},
                   {"file_path": "db/users.py", "severity": "low", "category": "style", "title": "Naming",
                    "message": "Rename q"}
                 ]}
                """;

        AnalysisReport report = parser.parse(output, "claude-test", 1234L);

        assertEquals(78.0, report.overallScore());
        assertEquals(62.5, report.securityScore());
        assertEquals("Solid change with one injection risk", report.summary());
        assertEquals(List.of("Use bound parameters"), report.recommendations());
        assertEquals(2, report.comments().size());
        AnalysisReport.ReportedComment first = report.comments().get(0);
        assertEquals(14, first.lineNumber());
        assertEquals("critical", first.severity());
        assertEquals("q = '?'", first.suggestedCode());
        AnalysisReport.ReportedComment second = report.comments().get(1);
        assertNull(second.lineNumber());
        assertNull(second.suggestedFix());
        assertEquals("claude-test", report.modelUsed());
        assertEquals(1234L, report.tokensUsed());
    }

    @Test
    void parse_missingFieldsStayNull() throws Exception {
        AnalysisReport report = parser.parse("{\"overall_score\": \"high\"}", null, null);

        assertNull(report.overallScore());
        assertNull(report.securityScore());
        assertNull(report.summary());
        assertTrue(report.recommendations().isEmpty());
        assertTrue(report.comments().isEmpty());
        assertNull(report.tokensUsed());
    }

    @Test
    void parse_jsonInsideMarkdownFence() throws Exception {
        String output = "Here is the review:\n```json\n{\"overall_score\": 91, \"summary\": \"Clean\"}\n```\nThanks";

        AnalysisReport report = parser.parse(output, "m", 1L);

        assertEquals(91.0, report.overallScore());
        assertEquals("Clean", report.summary());
    }

    @Test
    void parse_rejectsEmptyAndNonJsonOutput() {
        assertThrows(AnalysisProviderException.class, () -> parser.parse("  ", "m", 1L));
        assertThrows(AnalysisProviderException.class, () -> parser.parse("I could not review this.", "m", 1L));
        assertThrows(AnalysisProviderException.class, () -> parser.parse("[1, 2, 3]", "m", 1L));
    }

    @Test
    void extractJson_surroundingText() {
        assertEquals("{\"a\": 1}", parser.extractJson("Result: {\"a\": 1} done"));
        assertEquals("{\"a\": {\"b\": 2}}", parser.extractJson("{\"a\": {\"b\": 2}}\ntrailing"));
    }
}
