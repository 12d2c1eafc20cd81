package io.rangekeeper.provisioner;

public record WorkloadHandle(String value) {
    public WorkloadHandle {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("workload handle must not be blank");
        }
        value = value.trim();
    }
}
