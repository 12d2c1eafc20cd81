package io.rangekeeper.model;

public record InstanceRecord(
        String instanceId,
        String principalId,
        String challengeId,
        InstanceStatus status,
        String workloadHandle,
        long createdAtMs,
        long expiresAtMs,
        int extensionCount,
        Long lastExtendedAtMs,
        long version,
        String teardownClaim,
        Long claimedAtMs,
        String failureReason,
        long updatedAtMs,
        int teardownFailures,
        Long expireRetryAtMs
) {
    public boolean ownedBy(String principalId) {
        return principalId != null && principalId.equals(this.principalId);
    }

    public boolean claimed() {
        return teardownClaim != null && !teardownClaim.isBlank();
    }
}
