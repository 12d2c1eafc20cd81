package io.rangekeeper.model;

public record PolicyEntry(
        String challengeId,
        long baseRuntimeSeconds,
        long extensionIncrementSeconds,
        int maxExtensions,
        long maxLifetimeSeconds,
        String updatedBy,
        long updatedAtMs
) {
    public Policy toPolicy() {
        return Policy.ofSeconds(baseRuntimeSeconds, extensionIncrementSeconds, maxExtensions, maxLifetimeSeconds);
    }
}
