package io.rangekeeper.audit;

import io.rangekeeper.model.AuditAction;

import java.util.LinkedHashMap;
import java.util.Map;

public record AuditEvent(
        AuditAction action,
        String actor,
        String principalId,
        String instanceId,
        String challengeId,
        Map<String, Object> details
) {
    public AuditEvent {
        if (action == null) {
            throw new IllegalArgumentException("audit action must not be null");
        }
        actor = actor == null || actor.isBlank() ? "system" : actor.trim();
        details = details == null ? Map.of() : new LinkedHashMap<>(details);
    }

    public static AuditEvent of(AuditAction action, String actor, String principalId, String instanceId,
                                String challengeId, Map<String, Object> details) {
        return new AuditEvent(action, actor, principalId, instanceId, challengeId, details);
    }

    public static AuditEvent system(AuditAction action, Map<String, Object> details) {
        return new AuditEvent(action, "system", null, null, null, details);
    }
}
