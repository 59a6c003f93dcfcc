package com.dbbaskette.codeguardian.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record FeedbackRequest(
        @NotBlank(message = "feedback is required")
        String feedback
) {}
