package io.rangekeeper.model;

public record InstanceView(
        String instanceId,
        String principalId,
        String challengeId,
        String status,
        boolean active,
        long createdAtMs,
        long expiresAtMs,
        long remainingSeconds,
        int extensionCount,
        int maxExtensions,
        Long lastExtendedAtMs
) {
    public static InstanceView of(InstanceRecord record, Policy policy, long nowMs) {
        boolean active = record.status() == InstanceStatus.RUNNING && record.expiresAtMs() > nowMs;
        long remaining = active ? Math.max(0L, (record.expiresAtMs() - nowMs) / 1000L) : 0L;
        return new InstanceView(
                record.instanceId(),
                record.principalId(),
                record.challengeId(),
                record.status().name(),
                active,
                record.createdAtMs(),
                record.expiresAtMs(),
                remaining,
                record.extensionCount(),
                policy.maxExtensions(),
                record.lastExtendedAtMs()
        );
    }
}
