package com.dbbaskette.codeguardian.service.fix;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outcome of one bulk apply. Every requested id appears in exactly one list.
 */
public record BulkFixResult(
        List<AppliedItem> applied,
        List<RejectedItem> failed,
        List<RejectedItem> skipped,
        Summary summary
) {
    public record AppliedItem(String fixId, LocalDateTime appliedAt) {}

    public record RejectedItem(String fixId, String reason) {}

    public record Summary(int total, int applied, int failed, int skipped) {}

    public BulkFixResult(List<AppliedItem> applied, List<RejectedItem> failed, List<RejectedItem> skipped) {
        this(List.copyOf(applied), List.copyOf(failed), List.copyOf(skipped),
                new Summary(applied.size() + failed.size() + skipped.size(),
                        applied.size(), failed.size(), skipped.size()));
    }
}
