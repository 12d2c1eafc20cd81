package io.rangekeeper.provisioner;

import io.rangekeeper.security.FlagSecret;

import java.util.Map;

public record WorkloadSpec(
        String instanceId,
        String principalId,
        String challengeId,
        FlagSecret flag,
        long expiresAtMs,
        Map<String, String> attributes
) {
    public WorkloadSpec {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
