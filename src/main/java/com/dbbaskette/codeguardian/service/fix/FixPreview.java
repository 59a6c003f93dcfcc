package com.dbbaskette.codeguardian.service.fix;

import java.util.List;

public record FixPreview(
        String fixId,
        String originalCode,
        String suggestedFix,
        List<String> diff,
        DiffComputer.DiffStats stats,
        String explanation,
        double confidence,
        boolean canAutoApply
) {}
