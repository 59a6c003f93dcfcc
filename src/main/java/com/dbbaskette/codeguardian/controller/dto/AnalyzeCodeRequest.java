package com.dbbaskette.codeguardian.controller.dto;

import jakarta.validation.constraints.NotNull;

public record AnalyzeCodeRequest(
        @NotNull(message = "code is required")
        String code,

        String language
) {}
