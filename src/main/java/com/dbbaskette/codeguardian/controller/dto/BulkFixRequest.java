package com.dbbaskette.codeguardian.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Size and content of {@code fix_ids} are checked by the bulk applier, not here.
 */
public record BulkFixRequest(
        @JsonProperty("fix_ids")
        List<String> fixIds
) {}
