package com.dbbaskette.codeguardian.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record TriggerReviewRequest(
        @JsonProperty("pull_request_id")
        @NotNull(message = "pull_request_id is required")
        @Positive(message = "pull_request_id must be positive")
        Long pullRequestId,

        @JsonProperty("review_type")
        String reviewType
) {}
