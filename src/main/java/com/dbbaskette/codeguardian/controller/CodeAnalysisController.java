package com.dbbaskette.codeguardian.controller;

import com.dbbaskette.codeguardian.controller.dto.AnalyzeCodeRequest;
import com.dbbaskette.codeguardian.service.fix.CodePatternScanner;
import com.dbbaskette.codeguardian.service.fix.ReviewFixes;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/code")
public class CodeAnalysisController {

    private final CodePatternScanner scanner;

    public CodeAnalysisController(CodePatternScanner scanner) {
        this.scanner = scanner;
    }

    @PostMapping("/analyze-fix")
    public ResponseEntity<ApiResponse<ReviewFixes>> analyzeFix(@Valid @RequestBody AnalyzeCodeRequest request) {
        return ApiResponses.from(scanner.scan(request.code(), request.language()), HttpStatus.OK,
                fixes -> "Found " + fixes.totalFixes() + " potential fixes");
    }
}
