package io.rangekeeper.audit;

import io.rangekeeper.model.AuditAction;

public record AuditQuery(
        String principalId,
        String challengeId,
        String instanceId,
        AuditAction action,
        Long sinceMs,
        Long untilMs,
        int limit
) {
    public static final int DEFAULT_LIMIT = 200;
    public static final int MAX_LIMIT = 5_000;

    public AuditQuery {
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null, DEFAULT_LIMIT);
    }

    public AuditQuery withPrincipal(String value) {
        return new AuditQuery(value, challengeId, instanceId, action, sinceMs, untilMs, limit);
    }

    public AuditQuery withChallenge(String value) {
        return new AuditQuery(principalId, value, instanceId, action, sinceMs, untilMs, limit);
    }

    public AuditQuery withInstance(String value) {
        return new AuditQuery(principalId, challengeId, value, action, sinceMs, untilMs, limit);
    }

    public AuditQuery withAction(AuditAction value) {
        return new AuditQuery(principalId, challengeId, instanceId, value, sinceMs, untilMs, limit);
    }

    public AuditQuery between(Long since, Long until) {
        return new AuditQuery(principalId, challengeId, instanceId, action, since, until, limit);
    }

    public AuditQuery withLimit(int value) {
        return new AuditQuery(principalId, challengeId, instanceId, action, sinceMs, untilMs, value);
    }
}
