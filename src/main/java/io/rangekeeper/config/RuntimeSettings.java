package io.rangekeeper.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.rangekeeper.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public record RuntimeSettings(
        long baseRuntimeSeconds,
        long extensionIncrementSeconds,
        int maxExtensions,
        long maxLifetimeSeconds,
        int provisionerMaxAttempts,
        long provisionerTimeoutMs,
        long baseBackoffMs,
        long maxBackoffMs,
        long storeTimeoutMs,
        long lockWaitMs,
        long reaperIntervalMs,
        int reaperBatchSize,
        long teardownClaimTimeoutMs,
        String flagPrefix,
        String defaultFlagTemplate,
        List<String> provisionerStartCommand,
        List<String> provisionerStopCommand
) {
    public RuntimeSettings {
        provisionerStartCommand = provisionerStartCommand == null ? List.of() : List.copyOf(provisionerStartCommand);
        provisionerStopCommand = provisionerStopCommand == null ? List.of() : List.copyOf(provisionerStopCommand);
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                RangeKeeperConfig.DEFAULT_BASE_RUNTIME_SECONDS,
                RangeKeeperConfig.DEFAULT_EXTENSION_INCREMENT_SECONDS,
                RangeKeeperConfig.DEFAULT_MAX_EXTENSIONS,
                RangeKeeperConfig.DEFAULT_MAX_LIFETIME_SECONDS,
                RangeKeeperConfig.DEFAULT_PROVISIONER_MAX_ATTEMPTS,
                RangeKeeperConfig.DEFAULT_PROVISIONER_TIMEOUT_MS,
                RangeKeeperConfig.DEFAULT_BASE_BACKOFF_MS,
                RangeKeeperConfig.DEFAULT_MAX_BACKOFF_MS,
                RangeKeeperConfig.DEFAULT_STORE_TIMEOUT_MS,
                RangeKeeperConfig.DEFAULT_LOCK_WAIT_MS,
                RangeKeeperConfig.DEFAULT_REAPER_INTERVAL_MS,
                RangeKeeperConfig.DEFAULT_REAPER_BATCH_SIZE,
                RangeKeeperConfig.DEFAULT_TEARDOWN_CLAIM_TIMEOUT_MS,
                RangeKeeperConfig.DEFAULT_FLAG_PREFIX,
                RangeKeeperConfig.DEFAULT_FLAG_TEMPLATE,
                List.of(),
                List.of()
        );
    }

    public static RuntimeSettings load(Path settingsFile) {
        RuntimeSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + settingsFile, e);
        }
    }

    static RuntimeSettings fromFile(SettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        return new RuntimeSettings(
                file.baseRuntimeSeconds() == null ? defaults.baseRuntimeSeconds() : file.baseRuntimeSeconds(),
                file.extensionIncrementSeconds() == null ? defaults.extensionIncrementSeconds() : file.extensionIncrementSeconds(),
                file.maxExtensions() == null ? defaults.maxExtensions() : file.maxExtensions(),
                file.maxLifetimeSeconds() == null ? defaults.maxLifetimeSeconds() : file.maxLifetimeSeconds(),
                sanitizeInt(file.provisionerMaxAttempts(), defaults.provisionerMaxAttempts(), 1),
                sanitizeLong(file.provisionerTimeoutMs(), defaults.provisionerTimeoutMs(), 100L),
                baseBackoff,
                maxBackoff,
                sanitizeLong(file.storeTimeoutMs(), defaults.storeTimeoutMs(), 100L),
                sanitizeLong(file.lockWaitMs(), defaults.lockWaitMs(), 10L),
                sanitizeLong(file.reaperIntervalMs(), defaults.reaperIntervalMs(), 1_000L),
                sanitizeInt(file.reaperBatchSize(), defaults.reaperBatchSize(), 1),
                sanitizeLong(file.teardownClaimTimeoutMs(), defaults.teardownClaimTimeoutMs(), 1_000L),
                sanitizeString(file.flagPrefix(), defaults.flagPrefix()),
                sanitizeString(file.defaultFlagTemplate(), defaults.defaultFlagTemplate()),
                file.provisionerStartCommand() == null ? defaults.provisionerStartCommand() : file.provisionerStartCommand(),
                file.provisionerStopCommand() == null ? defaults.provisionerStopCommand() : file.provisionerStopCommand()
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static String sanitizeString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long baseRuntimeSeconds,
            Long extensionIncrementSeconds,
            Integer maxExtensions,
            Long maxLifetimeSeconds,
            Integer provisionerMaxAttempts,
            Long provisionerTimeoutMs,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long storeTimeoutMs,
            Long lockWaitMs,
            Long reaperIntervalMs,
            Integer reaperBatchSize,
            Long teardownClaimTimeoutMs,
            String flagPrefix,
            String defaultFlagTemplate,
            List<String> provisionerStartCommand,
            List<String> provisionerStopCommand
    ) {
    }
}
