package io.rangekeeper.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class RangeKeeperConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE = "rangekeeper-settings.json";
    public static final long DEFAULT_BASE_RUNTIME_SECONDS = 900L;
    public static final long DEFAULT_EXTENSION_INCREMENT_SECONDS = 900L;
    public static final int DEFAULT_MAX_EXTENSIONS = 5;
    public static final long DEFAULT_MAX_LIFETIME_SECONDS = 5_400L;
    public static final int DEFAULT_PROVISIONER_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_PROVISIONER_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_BASE_BACKOFF_MS = 500L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 10_000L;
    public static final long DEFAULT_STORE_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_LOCK_WAIT_MS = 10_000L;
    public static final long DEFAULT_REAPER_INTERVAL_MS = 60_000L;
    public static final int DEFAULT_REAPER_BATCH_SIZE = 50;
    public static final long DEFAULT_TEARDOWN_CLAIM_TIMEOUT_MS = 10L * 60L * 1000L;
    public static final String DEFAULT_FLAG_PREFIX = "FLAG";
    public static final String DEFAULT_FLAG_TEMPLATE = "<hex>_<hex>";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public RangeKeeperConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static RangeKeeperConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static RangeKeeperConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new RangeKeeperConfig(scoped, base, safeNamespace);
    }

    private static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("rangekeeper.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path keyringFile() {
        return securityRoot().resolve("flag-keys.json");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }
}
