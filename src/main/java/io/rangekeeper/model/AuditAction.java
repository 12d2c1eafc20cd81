package io.rangekeeper.model;

public enum AuditAction {
    CREATED,
    EXTENDED,
    STOPPED_MANUAL,
    STOPPED_AUTO,
    FLAG_ISSUED,
    FLAG_VALIDATED,
    FLAG_REJECTED,
    FLAG_REVOKED,
    FAILED_CREATE,
    FAILED_EXTEND,
    FAILED_STOP,
    FAILED_EXPIRE,
    KEY_ROTATED,
    POLICY_UPDATED,
    POLICY_REMOVED,
    INSTANCE_PURGED,
    INVARIANT_VIOLATION;

    public String wireName() {
        return name().toLowerCase();
    }

    public static AuditAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Audit action must not be blank");
        }
        for (AuditAction value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + raw);
    }
}
