package com.dbbaskette.codeguardian.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record PreviewFixRequest(
        @JsonProperty("fix_id")
        @NotBlank(message = "fix_id is required")
        String fixId
) {}
