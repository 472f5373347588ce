package com.archiver.services.stats;

import java.util.List;

/**
 * Totals of one archive run.
 */
public record Summary(
        int submittedCount,
        int succeededCount,
        long totalBytes,
        List<FailureRecord> failures
) {
    public Summary {
        failures = List.copyOf(failures);
    }

    public int failedCount() {
        return submittedCount - succeededCount;
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
