package com.dbbaskette.codeguardian.controller;

import com.dbbaskette.codeguardian.controller.dto.BulkFixRequest;
import com.dbbaskette.codeguardian.controller.dto.PreviewFixRequest;
import com.dbbaskette.codeguardian.service.fix.AppliedFix;
import com.dbbaskette.codeguardian.service.fix.BulkFixApplier;
import com.dbbaskette.codeguardian.service.fix.BulkFixResult;
import com.dbbaskette.codeguardian.service.fix.FixPreview;
import com.dbbaskette.codeguardian.service.fix.FixService;
import com.dbbaskette.codeguardian.service.fix.ReviewFixes;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reviews/{reviewId}/fixes")
public class FixController {

    private final FixService fixService;
    private final BulkFixApplier bulkFixApplier;

    public FixController(FixService fixService, BulkFixApplier bulkFixApplier) {
        this.fixService = fixService;
        this.bulkFixApplier = bulkFixApplier;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<ReviewFixes>> list(@PathVariable Long reviewId) {
        return ApiResponses.from(fixService.listFixes(reviewId), HttpStatus.OK,
                fixes -> "Found " + fixes.totalFixes() + " fix suggestions");
    }

    @PostMapping("/bulk")
    public ResponseEntity<ApiResponse<BulkFixResult>> bulkApply(@PathVariable Long reviewId,
                                                                @RequestBody BulkFixRequest request) {
        return ApiResponses.from(bulkFixApplier.apply(reviewId, request.fixIds()), HttpStatus.OK,
                result -> "Applied " + result.summary().applied() + " of " + result.summary().total() + " fixes");
    }

    @PostMapping("/preview")
    public ResponseEntity<ApiResponse<FixPreview>> preview(@PathVariable Long reviewId,
                                                           @Valid @RequestBody PreviewFixRequest request) {
        return ApiResponses.from(fixService.previewFix(reviewId, request.fixId()), "Fix preview generated");
    }

    @PostMapping("/{fixId}")
    public ResponseEntity<ApiResponse<AppliedFix>> apply(@PathVariable Long reviewId, @PathVariable String fixId) {
        return ApiResponses.from(fixService.applyFix(reviewId, fixId), "Fix applied successfully");
    }
}
