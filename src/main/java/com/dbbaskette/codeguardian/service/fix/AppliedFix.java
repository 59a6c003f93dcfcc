package com.dbbaskette.codeguardian.service.fix;

import java.time.LocalDateTime;
import java.util.List;

public record AppliedFix(
        String fixId,
        boolean applied,
        String originalCode,
        String fixedCode,
        List<String> diff,
        LocalDateTime appliedAt
) {}
