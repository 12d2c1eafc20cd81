package io.rangekeeper.audit;

import java.util.Map;

public record AuditEntry(
        long id,
        long occurredAtMs,
        String action,
        String actor,
        String principalId,
        String instanceId,
        String challengeId,
        Map<String, Object> details,
        String prevHash,
        String hash
) {
}
