package io.rangekeeper.reaper;

public record SweepSummary(
        int examined,
        int expired,
        int notDue,
        int skipped,
        int teardownFailed,
        int errors,
        int claimsReleased,
        long startedAtMs,
        long durationMs
) {
}
