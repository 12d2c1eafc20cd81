package io.rangekeeper.policy;

import io.rangekeeper.audit.AuditEvent;
import io.rangekeeper.audit.AuditLog;
import io.rangekeeper.config.RuntimeSettings;
import io.rangekeeper.error.PolicyConfigurationException;
import io.rangekeeper.model.AuditAction;
import io.rangekeeper.model.Policy;
import io.rangekeeper.model.PolicyEntry;
import io.rangekeeper.storage.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class PolicyResolver {
    private static final Logger LOG = LoggerFactory.getLogger(PolicyResolver.class);

    private final PolicyStore store;
    private final AuditLog auditLog;
    private final Clock clock;
    private final Policy globalDefault;

    public PolicyResolver(PolicyStore store, AuditLog auditLog, Clock clock, RuntimeSettings settings) {
        this(store, auditLog, clock, defaultFrom(settings));
    }

    public PolicyResolver(PolicyStore store, AuditLog auditLog, Clock clock, Policy globalDefault) {
        if (globalDefault == null) {
            throw new PolicyConfigurationException("global default policy is missing");
        }
        this.store = store;
        this.auditLog = auditLog;
        this.clock = clock;
        this.globalDefault = globalDefault;
    }

    public static Policy defaultFrom(RuntimeSettings settings) {
        if (settings == null) {
            throw new PolicyConfigurationException("runtime settings are missing");
        }
        return Policy.ofSeconds(
                settings.baseRuntimeSeconds(),
                settings.extensionIncrementSeconds(),
                settings.maxExtensions(),
                settings.maxLifetimeSeconds()
        );
    }

    public Policy resolve(String challengeId) {
        if (challengeId == null || challengeId.isBlank()) {
            return globalDefault;
        }
        Optional<PolicyEntry> override = store.find(challengeId);
        if (override.isEmpty()) {
            return globalDefault;
        }
        try {
            return override.get().toPolicy();
        } catch (PolicyConfigurationException e) {
            // Rows are validated on write; this only happens after a manual edit of the table.
            LOG.error("Stored policy for challenge={} is invalid, using global default: {}", challengeId, e.getMessage());
            return globalDefault;
        }
    }

    public Policy globalDefault() {
        return globalDefault;
    }

    public PolicyEntry upsert(String challengeId, Policy policy, String actor) {
        if (challengeId == null || challengeId.isBlank()) {
            throw new IllegalArgumentException("challengeId must not be blank");
        }
        PolicyEntry entry = new PolicyEntry(
                challengeId.trim(),
                policy.baseRuntime().toSeconds(),
                policy.extensionIncrement().toSeconds(),
                policy.maxExtensions(),
                policy.maxLifetime().toSeconds(),
                actor,
                clock.millis()
        );
        store.upsert(entry);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("base_runtime_seconds", entry.baseRuntimeSeconds());
        details.put("extension_increment_seconds", entry.extensionIncrementSeconds());
        details.put("max_extensions", entry.maxExtensions());
        details.put("max_lifetime_seconds", entry.maxLifetimeSeconds());
        auditLog.record(AuditEvent.of(AuditAction.POLICY_UPDATED, actor, null, null, entry.challengeId(), details));
        LOG.info("Policy override stored for challenge={} by {}", entry.challengeId(), actor);
        return entry;
    }

    public boolean remove(String challengeId, String actor) {
        boolean removed = store.remove(challengeId);
        if (removed) {
            auditLog.record(AuditEvent.of(AuditAction.POLICY_REMOVED, actor, null, null, challengeId, Map.of()));
            LOG.info("Policy override removed for challenge={} by {}", challengeId, actor);
        }
        return removed;
    }

    public List<PolicyEntry> list() {
        return store.list();
    }
}
