package com.dbbaskette.codeguardian.controller;

import com.dbbaskette.codeguardian.config.CodeGuardianProperties;
import com.dbbaskette.codeguardian.service.fix.CodePatternScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CodeAnalysisControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = ControllerTestSupport.mockMvc(
                new CodeAnalysisController(new CodePatternScanner(new CodeGuardianProperties())));
    }

    @Test
    void analyzeFix_findsSqlInterpolation() throws Exception {
        String body = """
                {"code": "uid = request.args['id']\\ncursor.execute(\\"SELECT * FROM users WHERE id = %s\\" % uid)",
                 "language": "python"}
                """;

        mockMvc.perform(post("/api/code/analyze-fix")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.language").value("python"))
                .andExpect(jsonPath("$.data.total_fixes").value(1))
                .andExpect(jsonPath("$.data.fixes[0].line_number").value(2))
                .andExpect(jsonPath("$.data.fixes[0].severity").value("critical"))
                .andExpect(jsonPath("$.data.review_id").doesNotExist());
    }

    @Test
    void analyzeFix_shortCodeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/code/analyze-fix")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"x = 1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.field").value("code"));
    }

    @Test
    void analyzeFix_missingCodeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/code/analyze-fix")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"language\": \"python\"}"))
                .andExpect(status().isBadRequest());
    }
}
