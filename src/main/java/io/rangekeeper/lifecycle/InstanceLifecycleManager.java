package io.rangekeeper.lifecycle;

import io.rangekeeper.audit.AuditEvent;
import io.rangekeeper.audit.AuditLog;
import io.rangekeeper.error.ProvisionerException;
import io.rangekeeper.error.RangeKeeperException;
import io.rangekeeper.model.AuditAction;
import io.rangekeeper.model.CredentialRecord;
import io.rangekeeper.model.ErrorKind;
import io.rangekeeper.model.InstanceRecord;
import io.rangekeeper.model.InstanceStatus;
import io.rangekeeper.model.InstanceView;
import io.rangekeeper.model.Policy;
import io.rangekeeper.model.Requester;
import io.rangekeeper.model.StopReason;
import io.rangekeeper.policy.PolicyResolver;
import io.rangekeeper.provisioner.ProvisionerGateway;
import io.rangekeeper.provisioner.WorkloadHandle;
import io.rangekeeper.provisioner.WorkloadSpec;
import io.rangekeeper.security.CredentialEngine;
import io.rangekeeper.security.FlagSecret;
import io.rangekeeper.storage.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Single authority over instance state.
 *
 * <p>Every transition runs under the instance's in-process lock, re-reads the row, and then
 * writes with a conditional update on {@code version}; teardown additionally takes a claim
 * so that only one actor ever stops a workload. Rejections surface as
 * {@link RangeKeeperException} carrying the {@link ErrorKind}, and every rejection of a
 * user-facing call is audited.
 */
public final class InstanceLifecycleManager {
    private static final Logger LOG = LoggerFactory.getLogger(InstanceLifecycleManager.class);
    static final long EXPIRE_RETRY_BASE_MS = 30_000L;
    static final long EXPIRE_RETRY_MAX_MS = 15L * 60L * 1000L;

    private final InstanceStore instances;
    private final PolicyResolver policies;
    private final CredentialEngine credentials;
    private final ProvisionerGateway gateway;
    private final AuditLog auditLog;
    private final Clock clock;
    private final InstanceLocks locks;
    private final Supplier<String> idGenerator;

    public InstanceLifecycleManager(
            InstanceStore instances,
            PolicyResolver policies,
            CredentialEngine credentials,
            ProvisionerGateway gateway,
            AuditLog auditLog,
            Clock clock,
            long lockWaitMs
    ) {
        this(instances, policies, credentials, gateway, auditLog, clock, lockWaitMs, () -> UUID.randomUUID().toString());
    }

    InstanceLifecycleManager(
            InstanceStore instances,
            PolicyResolver policies,
            CredentialEngine credentials,
            ProvisionerGateway gateway,
            AuditLog auditLog,
            Clock clock,
            long lockWaitMs,
            Supplier<String> idGenerator
    ) {
        this.instances = instances;
        this.policies = policies;
        this.credentials = credentials;
        this.gateway = gateway;
        this.auditLog = auditLog;
        this.clock = clock;
        this.locks = new InstanceLocks(lockWaitMs);
        this.idGenerator = idGenerator;
    }

    public InstanceRecord create(String principalId, String challengeId, CreateRequest request) {
        if (principalId == null || principalId.isBlank() || challengeId == null || challengeId.isBlank()) {
            throw new RangeKeeperException(ErrorKind.INVALID_REQUEST, "principalId and challengeId are required");
        }
        CreateRequest req = request == null ? CreateRequest.defaults() : request;
        String actor = Requester.principal(principalId).actor();
        Policy policy = policies.resolve(challengeId);
        long now = clock.millis();
        String instanceId = idGenerator.get();
        InstanceStore.InsertOutcome inserted = instances.insertProvisioning(new InstanceStore.NewInstance(
                instanceId, principalId, challengeId, now + policy.baseRuntime().toMillis(), now));
        if (inserted.conflict()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", "already_running");
            if (inserted.record() != null) {
                details.put("active_instance_id", inserted.record().instanceId());
            }
            auditLog.record(AuditEvent.of(AuditAction.FAILED_CREATE, actor, principalId, null, challengeId, details));
            throw new RangeKeeperException(ErrorKind.ALREADY_RUNNING,
                    "Instance already active for principal=" + principalId + " challenge=" + challengeId);
        }
        InstanceRecord row = inserted.record();

        InstanceLocks.Held held = acquire(instanceId);
        if (held == null) {
            failCreate(row, actor, "lock_timeout", null);
            throw new RangeKeeperException(ErrorKind.IN_PROGRESS, "Instance " + instanceId + " is busy");
        }
        try (held) {
            FlagSecret flag;
            try {
                flag = credentials.mint(req.flagTemplate());
            } catch (IllegalArgumentException e) {
                failCreate(row, actor, "invalid_flag_template", e.getMessage());
                throw new RangeKeeperException(ErrorKind.INVALID_REQUEST, e.getMessage(), e);
            }

            WorkloadHandle handle;
            try {
                handle = gateway.start(new WorkloadSpec(instanceId, principalId, challengeId, flag,
                        row.expiresAtMs(), req.attributes()));
            } catch (ProvisionerException e) {
                failCreate(row, actor, e.isTransient() ? "provisioner_unavailable" : "provisioner_rejected", e.getMessage());
                throw new RangeKeeperException(
                        e.isTransient() ? ErrorKind.PROVISIONER_UNAVAILABLE : ErrorKind.PROVISIONER_REJECTED,
                        "Provisioner failed to start instance " + instanceId + ": " + e.getMessage(),
                        e
                );
            }

            CredentialRecord sealed;
            boolean activated;
            try {
                sealed = credentials.seal(instanceId, flag);
                activated = instances.activate(instanceId, row.version(), handle.value(), sealed, clock.millis());
            } catch (RangeKeeperException e) {
                if (e.kind() == ErrorKind.DUPLICATE_BINDING) {
                    credentials.reportDuplicateBinding(instanceId, principalId, challengeId);
                }
                abandonWorkload(row, handle);
                failCreate(row, actor, e.kind().name().toLowerCase(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                abandonWorkload(row, handle);
                failCreate(row, actor, "credential_store_failed", e.getMessage());
                throw new RangeKeeperException(ErrorKind.INTERNAL, "Failed to bind credential for " + instanceId, e);
            }
            if (!activated) {
                LOG.error("CRITICAL instance={} left PROVISIONING while its create held the lock", instanceId);
                invariantViolation(row, "provisioning_row_changed_during_create");
                abandonWorkload(row, handle);
                failCreate(row, actor, "state_changed", null);
                throw new RangeKeeperException(ErrorKind.INTERNAL, "Instance " + instanceId + " changed during create");
            }

            Map<String, Object> created = new LinkedHashMap<>();
            created.put("expires_at_ms", row.expiresAtMs());
            created.put("base_runtime_seconds", policy.baseRuntime().toSeconds());
            created.put("workload_handle", handle.value());
            auditLog.record(AuditEvent.of(AuditAction.CREATED, actor, principalId, instanceId, challengeId, created));
            auditLog.record(AuditEvent.of(AuditAction.FLAG_ISSUED, "system", principalId, instanceId, challengeId,
                    Map.of("key_id", sealed.keyId())));
            LOG.info("Instance created instance={} principal={} challenge={} expiresAtMs={} flag={}",
                    instanceId, principalId, challengeId, row.expiresAtMs(), flag.redacted());
            return require(instanceId);
        }
    }

    public InstanceRecord extend(String instanceId, Requester requester) {
        InstanceRecord row = find(instanceId);
        if (!requester.mayOperateOn(row)) {
            throw reject(ErrorKind.NOT_OWNER, AuditAction.FAILED_EXTEND, row, requester, "caller does not own instance");
        }
        InstanceLocks.Held held = acquire(instanceId);
        if (held == null) {
            throw reject(ErrorKind.IN_PROGRESS, AuditAction.FAILED_EXTEND, row, requester, "instance is busy");
        }
        try (held) {
            InstanceRecord current = find(instanceId);
            long now = clock.millis();
            if (current.status() == InstanceStatus.PROVISIONING) {
                throw reject(ErrorKind.IN_PROGRESS, AuditAction.FAILED_EXTEND, current, requester, "instance is still provisioning");
            }
            if (current.status() != InstanceStatus.RUNNING || current.claimed() || current.expiresAtMs() <= now) {
                throw reject(ErrorKind.NOT_RUNNING, AuditAction.FAILED_EXTEND, current, requester, "instance is not running");
            }
            Policy policy = policies.resolve(current.challengeId());
            ExtensionMath.Decision decision = ExtensionMath.decide(
                    current.createdAtMs(), current.expiresAtMs(), current.extensionCount(), policy);
            switch (decision.verdict()) {
                case LIMIT_REACHED -> throw reject(ErrorKind.EXTENSION_LIMIT_REACHED, AuditAction.FAILED_EXTEND, current, requester,
                        "extension limit of " + policy.maxExtensions() + " reached");
                case CAP_REACHED -> throw reject(ErrorKind.LIFETIME_CAP_REACHED, AuditAction.FAILED_EXTEND, current, requester,
                        "instance is at its maximum lifetime");
                default -> {
                }
            }
            boolean applied = instances.applyExtension(
                    instanceId, current.version(), decision.newExtensionCount(), decision.newExpiresAtMs(), now);
            if (!applied) {
                throw reject(ErrorKind.IN_PROGRESS, AuditAction.FAILED_EXTEND, current, requester, "instance changed concurrently");
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("old_expires_at_ms", current.expiresAtMs());
            details.put("new_expires_at_ms", decision.newExpiresAtMs());
            details.put("extension_number", decision.newExtensionCount());
            details.put("max_extensions", policy.maxExtensions());
            auditLog.record(AuditEvent.of(AuditAction.EXTENDED, requester.actor(), current.principalId(),
                    instanceId, current.challengeId(), details));
            LOG.info("Instance extended instance={} extension={}/{} expiresAtMs {} -> {}",
                    instanceId, decision.newExtensionCount(), policy.maxExtensions(),
                    current.expiresAtMs(), decision.newExpiresAtMs());
            return require(instanceId);
        }
    }

    public InstanceRecord stop(String instanceId, Requester requester, StopReason reason) {
        AuditAction failure = AuditAction.FAILED_STOP;
        InstanceRecord row = find(instanceId);
        if (!requester.mayOperateOn(row)) {
            throw reject(ErrorKind.NOT_OWNER, failure, row, requester, "caller does not own instance");
        }
        if (row.status() == InstanceStatus.PROVISIONING) {
            throw reject(ErrorKind.IN_PROGRESS, failure, row, requester, "instance is still provisioning");
        }
        InstanceLocks.Held held = acquire(instanceId);
        if (held == null) {
            throw reject(ErrorKind.IN_PROGRESS, failure, row, requester, "instance is busy");
        }
        try (held) {
            InstanceRecord current = find(instanceId);
            if (current.status() == InstanceStatus.PROVISIONING) {
                throw reject(ErrorKind.IN_PROGRESS, failure, current, requester, "instance is still provisioning");
            }
            if (current.status() != InstanceStatus.RUNNING) {
                throw reject(ErrorKind.NOT_RUNNING, failure, current, requester, "instance is " + current.status());
            }
            if (current.claimed()) {
                throw reject(ErrorKind.IN_PROGRESS, failure, current, requester, "teardown already in progress");
            }
            StopReason effective = reason == null ? StopReason.MANUAL : reason;
            Teardown outcome = teardown(current, requester, effective, null);
            switch (outcome.kind()) {
                case TERMINATED -> {
                    return require(instanceId);
                }
                case CLAIM_LOST -> throw new RangeKeeperException(ErrorKind.IN_PROGRESS,
                        "Instance " + instanceId + " changed concurrently");
                default -> {
                    ProvisionerException cause = outcome.cause();
                    ErrorKind kind = cause == null || cause.isTransient()
                            ? ErrorKind.PROVISIONER_UNAVAILABLE
                            : ErrorKind.PROVISIONER_REJECTED;
                    throw new RangeKeeperException(kind, "Teardown failed for " + instanceId
                            + (cause == null ? "" : ": " + cause.getMessage()), cause);
                }
            }
        }
    }

    // Deadline is re-checked under the lock; an extension that landed after the listing wins.
    public ExpireResult expire(String instanceId) {
        InstanceLocks.Held held = acquire(instanceId);
        if (held == null) {
            return ExpireResult.SKIPPED;
        }
        try (held) {
            Optional<InstanceRecord> found = instances.get(instanceId);
            if (found.isEmpty()) {
                return ExpireResult.SKIPPED;
            }
            InstanceRecord current = found.get();
            if (current.status() != InstanceStatus.RUNNING || current.claimed()) {
                return ExpireResult.SKIPPED;
            }
            long now = clock.millis();
            if (current.expiresAtMs() > now) {
                return ExpireResult.NOT_DUE;
            }
            Teardown outcome = teardown(current, Requester.system(), StopReason.AUTO, now);
            return switch (outcome.kind()) {
                case TERMINATED -> ExpireResult.EXPIRED;
                case TEARDOWN_FAILED -> ExpireResult.TEARDOWN_FAILED;
                case CLAIM_LOST -> instances.get(instanceId)
                        .filter(r -> r.status() == InstanceStatus.RUNNING && r.expiresAtMs() > now)
                        .map(r -> ExpireResult.NOT_DUE)
                        .orElse(ExpireResult.SKIPPED);
            };
        }
    }

    public Optional<InstanceView> status(String instanceId) {
        return instances.get(instanceId).map(this::view);
    }

    public Optional<InstanceView> status(String principalId, String challengeId) {
        return instances.findActive(principalId, challengeId).map(this::view);
    }

    public Optional<InstanceRecord> get(String instanceId) {
        return instances.get(instanceId);
    }

    public List<String> listExpired(int limit) {
        return instances.listExpiredRunning(clock.millis(), limit);
    }

    public List<String> releaseStaleClaims(long claimTimeoutMs) {
        long now = clock.millis();
        List<String> released = instances.releaseStaleClaims(now - claimTimeoutMs, now);
        for (String id : released) {
            LOG.warn("Released stale teardown claim instance={}", id);
        }
        return released;
    }

    public int purgeTerminated(Duration olderThan, int limit, String actor) {
        long cutoff = clock.millis() - Math.max(0L, olderThan.toMillis());
        List<InstanceRecord> purged = instances.purgeTerminal(cutoff, limit);
        for (InstanceRecord r : purged) {
            auditLog.record(AuditEvent.of(AuditAction.INSTANCE_PURGED, actor, r.principalId(), r.instanceId(),
                    r.challengeId(), Map.of("status", r.status().name())));
        }
        if (!purged.isEmpty()) {
            LOG.info("Purged {} terminal instances older than {}", purged.size(), olderThan);
        }
        return purged.size();
    }

    static long expireRetryDelayMs(int failures) {
        int shift = Math.max(0, Math.min(failures - 1, 5));
        return Math.min(EXPIRE_RETRY_BASE_MS << shift, EXPIRE_RETRY_MAX_MS);
    }

    private Teardown teardown(InstanceRecord current, Requester requester, StopReason reason, Long dueAtOrBeforeMs) {
        String instanceId = current.instanceId();
        AuditAction failure = reason == StopReason.AUTO ? AuditAction.FAILED_EXPIRE : AuditAction.FAILED_STOP;
        String claim = UUID.randomUUID().toString();
        if (!instances.claimTeardown(instanceId, current.version(), claim, dueAtOrBeforeMs, clock.millis())) {
            return new Teardown(TeardownKind.CLAIM_LOST, null);
        }
        try {
            if (current.workloadHandle() == null || current.workloadHandle().isBlank()) {
                LOG.error("CRITICAL running instance={} has no workload handle", instanceId);
                invariantViolation(current, "running_without_workload_handle");
                throw ProvisionerException.rejected("missing workload handle");
            }
            gateway.stop(new WorkloadHandle(current.workloadHandle()));
        } catch (ProvisionerException e) {
            long now = clock.millis();
            long retryAt = now + expireRetryDelayMs(current.teardownFailures() + 1);
            instances.releaseFailedTeardown(instanceId, claim, retryAt, now);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", e.isTransient() ? "provisioner_unavailable" : "provisioner_rejected");
            details.put("error", e.getMessage());
            details.put("teardown_failures", current.teardownFailures() + 1);
            details.put("retry_at_ms", retryAt);
            auditLog.record(AuditEvent.of(failure, requester.actor(), current.principalId(), instanceId,
                    current.challengeId(), details));
            LOG.warn("Teardown failed instance={} reason={}, left running: {}", instanceId, reason, e.getMessage());
            return new Teardown(TeardownKind.TEARDOWN_FAILED, e);
        }
        if (!instances.terminate(instanceId, claim, clock.millis())) {
            LOG.warn("Teardown claim for instance={} was released before it could terminate", instanceId);
            return new Teardown(TeardownKind.CLAIM_LOST, null);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("workload_handle", current.workloadHandle());
        details.put("expires_at_ms", current.expiresAtMs());
        details.put("extension_count", current.extensionCount());
        auditLog.record(AuditEvent.of(
                reason == StopReason.AUTO ? AuditAction.STOPPED_AUTO : AuditAction.STOPPED_MANUAL,
                requester.actor(), current.principalId(), instanceId, current.challengeId(), details));
        auditLog.record(AuditEvent.of(AuditAction.FLAG_REVOKED, "system", current.principalId(), instanceId,
                current.challengeId(), Map.of()));
        LOG.info("Instance terminated instance={} reason={}", instanceId, reason);
        return new Teardown(TeardownKind.TERMINATED, null);
    }

    private void abandonWorkload(InstanceRecord row, WorkloadHandle handle) {
        try {
            gateway.stop(handle);
        } catch (ProvisionerException e) {
            LOG.error("Workload {} for failed instance={} could not be torn down and may still be live: {}",
                    handle.value(), row.instanceId(), e.getMessage());
        }
    }

    private void failCreate(InstanceRecord row, String actor, String reason, String error) {
        try {
            if (!instances.markFailed(row.instanceId(), row.version(), reason, clock.millis())) {
                LOG.error("CRITICAL could not mark instance={} FAILED, row changed concurrently", row.instanceId());
            }
        } catch (RuntimeException e) {
            LOG.error("Could not mark instance={} FAILED: {}", row.instanceId(), e.getMessage(), e);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        if (error != null) {
            details.put("error", error);
        }
        auditLog.record(AuditEvent.of(AuditAction.FAILED_CREATE, actor, row.principalId(), row.instanceId(),
                row.challengeId(), details));
        LOG.warn("Instance create failed instance={} reason={}", row.instanceId(), reason);
    }

    private void invariantViolation(InstanceRecord row, String violation) {
        auditLog.record(AuditEvent.of(AuditAction.INVARIANT_VIOLATION, "system", row.principalId(), row.instanceId(),
                row.challengeId(), Map.of("violation", violation)));
    }

    private RangeKeeperException reject(ErrorKind kind, AuditAction action, InstanceRecord row, Requester requester, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", kind.name().toLowerCase());
        details.put("status", row.status().name());
        auditLog.record(AuditEvent.of(action, requester.actor(), row.principalId(), row.instanceId(), row.challengeId(), details));
        return new RangeKeeperException(kind, message);
    }

    private InstanceLocks.Held acquire(String instanceId) {
        try {
            return locks.tryAcquire(instanceId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private InstanceRecord find(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new RangeKeeperException(ErrorKind.INVALID_REQUEST, "instanceId is required");
        }
        return instances.get(instanceId)
                .orElseThrow(() -> new RangeKeeperException(ErrorKind.NOT_FOUND, "Unknown instance " + instanceId));
    }

    private InstanceRecord require(String instanceId) {
        return instances.get(instanceId)
                .orElseThrow(() -> new RangeKeeperException(ErrorKind.INTERNAL, "Instance " + instanceId + " vanished"));
    }

    private InstanceView view(InstanceRecord record) {
        return InstanceView.of(record, policies.resolve(record.challengeId()), clock.millis());
    }

    private enum TeardownKind {
        TERMINATED,
        CLAIM_LOST,
        TEARDOWN_FAILED
    }

    private record Teardown(TeardownKind kind, ProvisionerException cause) {
    }
}
