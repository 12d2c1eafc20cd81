package io.rangekeeper.model;

public enum InstanceStatus {
    PROVISIONING,
    RUNNING,
    TERMINATED,
    FAILED;

    public boolean terminal() {
        return this == TERMINATED || this == FAILED;
    }

    public static InstanceStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Instance status must not be blank");
        }
        return InstanceStatus.valueOf(raw.trim().toUpperCase());
    }
}
