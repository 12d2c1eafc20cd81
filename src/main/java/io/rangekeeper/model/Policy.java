package io.rangekeeper.model;

import io.rangekeeper.error.PolicyConfigurationException;

import java.time.Duration;

public record Policy(
        Duration baseRuntime,
        Duration extensionIncrement,
        int maxExtensions,
        Duration maxLifetime
) {
    public Policy {
        if (baseRuntime == null || extensionIncrement == null || maxLifetime == null) {
            throw new PolicyConfigurationException("policy durations must not be null");
        }
        if (baseRuntime.isNegative() || baseRuntime.isZero()) {
            throw new PolicyConfigurationException("base_runtime must be positive, got " + baseRuntime);
        }
        if (extensionIncrement.isNegative()) {
            throw new PolicyConfigurationException("extension_increment must not be negative, got " + extensionIncrement);
        }
        if (maxExtensions < 0) {
            throw new PolicyConfigurationException("max_extensions must not be negative, got " + maxExtensions);
        }
        if (maxLifetime.compareTo(baseRuntime) < 0) {
            throw new PolicyConfigurationException(
                    "max_lifetime must be >= base_runtime, got max_lifetime=" + maxLifetime + " base_runtime=" + baseRuntime
            );
        }
    }

    public static Policy ofSeconds(long baseRuntimeSeconds, long extensionIncrementSeconds, int maxExtensions, long maxLifetimeSeconds) {
        return new Policy(
                Duration.ofSeconds(baseRuntimeSeconds),
                Duration.ofSeconds(extensionIncrementSeconds),
                maxExtensions,
                Duration.ofSeconds(maxLifetimeSeconds)
        );
    }
}
