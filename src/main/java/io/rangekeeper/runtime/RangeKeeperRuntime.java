package io.rangekeeper.runtime;

import io.rangekeeper.audit.AuditEntry;
import io.rangekeeper.audit.AuditLog;
import io.rangekeeper.audit.AuditQuery;
import io.rangekeeper.audit.AuditVerification;
import io.rangekeeper.config.RangeKeeperConfig;
import io.rangekeeper.config.RuntimeSettings;
import io.rangekeeper.error.PolicyConfigurationException;
import io.rangekeeper.error.RangeKeeperException;
import io.rangekeeper.lifecycle.CreateRequest;
import io.rangekeeper.lifecycle.InstanceLifecycleManager;
import io.rangekeeper.model.ErrorKind;
import io.rangekeeper.model.FlagVerdict;
import io.rangekeeper.model.InstanceRecord;
import io.rangekeeper.model.InstanceStatus;
import io.rangekeeper.model.InstanceView;
import io.rangekeeper.model.Outcome;
import io.rangekeeper.model.Policy;
import io.rangekeeper.model.PolicyEntry;
import io.rangekeeper.model.Requester;
import io.rangekeeper.model.StopReason;
import io.rangekeeper.observability.PrometheusFormatter;
import io.rangekeeper.policy.PolicyResolver;
import io.rangekeeper.provisioner.CommandProvisioner;
import io.rangekeeper.provisioner.Provisioner;
import io.rangekeeper.provisioner.ProvisionerGateway;
import io.rangekeeper.reaper.ExpiryReaper;
import io.rangekeeper.reaper.SweepSummary;
import io.rangekeeper.security.CredentialEngine;
import io.rangekeeper.security.FileKeyProvider;
import io.rangekeeper.security.FlagCipher;
import io.rangekeeper.security.FlagGenerator;
import io.rangekeeper.storage.CredentialStore;
import io.rangekeeper.storage.Database;
import io.rangekeeper.storage.InstanceStore;
import io.rangekeeper.storage.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

public final class RangeKeeperRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RangeKeeperRuntime.class);

    private final RangeKeeperConfig config;
    private final RuntimeSettings settings;
    private final Clock clock;
    private final Database database;
    private final InstanceStore instanceStore;
    private final AuditLog auditLog;
    private final PolicyResolver policyResolver;
    private final CredentialEngine credentialEngine;
    private final ProvisionerGateway gateway;
    private final InstanceLifecycleManager lifecycle;
    private final ExpiryReaper reaper;

    public RangeKeeperRuntime(RangeKeeperConfig config) {
        this(config, null, Clock.systemUTC());
    }

    public RangeKeeperRuntime(RangeKeeperConfig config, Provisioner provisioner, Clock clock) {
        this.config = config;
        this.settings = RuntimeSettings.load(config.settingsFile());
        this.clock = clock;
        this.database = new Database(config, settings.storeTimeoutMs());
        CredentialStore credentialStore = new CredentialStore(database);
        this.instanceStore = new InstanceStore(database, credentialStore);
        this.auditLog = new AuditLog(database, AuditLog.loadOrCreateSigningSecret(config.auditSigningKeyFile()), clock);
        this.policyResolver = new PolicyResolver(new PolicyStore(database), auditLog, clock, settings);
        this.credentialEngine = new CredentialEngine(
                credentialStore,
                new FileKeyProvider(config.keyringFile()),
                new FlagCipher(),
                new FlagGenerator(settings.flagPrefix(), settings.defaultFlagTemplate()),
                auditLog,
                clock
        );
        Provisioner effective = provisioner != null
                ? provisioner
                : new CommandProvisioner(settings.provisionerStartCommand(), settings.provisionerStopCommand(), settings.provisionerTimeoutMs());
        this.gateway = new ProvisionerGateway(
                effective,
                settings.provisionerMaxAttempts(),
                settings.provisionerTimeoutMs(),
                settings.baseBackoffMs(),
                settings.maxBackoffMs()
        );
        this.lifecycle = new InstanceLifecycleManager(
                instanceStore, policyResolver, credentialEngine, gateway, auditLog, clock, settings.lockWaitMs());
        this.reaper = new ExpiryReaper(
                lifecycle, clock, settings.reaperBatchSize(), settings.reaperIntervalMs(), settings.teardownClaimTimeoutMs());
    }

    public void init() {
        database.init();
        LOG.info("RangeKeeper initialized root={} namespace={}", config.rootDir(), config.namespace());
    }

    public RangeKeeperConfig config() {
        return config;
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public Outcome<InstanceView> createInstance(String principalId, String challengeId, CreateRequest request) {
        return guard("create", () -> view(lifecycle.create(principalId, challengeId, request)));
    }

    public Outcome<InstanceView> extendInstance(String instanceId, Requester requester) {
        return guard("extend", () -> view(lifecycle.extend(instanceId, requester)));
    }

    public Outcome<InstanceView> stopInstance(String instanceId, Requester requester) {
        return guard("stop", () -> view(lifecycle.stop(instanceId, requester, StopReason.MANUAL)));
    }

    // Non-owners get NOT_FOUND, the same as for an unknown id.
    public Outcome<InstanceView> getInstanceStatus(String instanceId, Requester requester) {
        return guard("status", () -> {
            Optional<InstanceRecord> row = lifecycle.get(instanceId);
            if (row.isEmpty() || !requester.mayOperateOn(row.get())) {
                throw new RangeKeeperException(ErrorKind.NOT_FOUND, "Unknown instance " + instanceId);
            }
            return view(row.get());
        });
    }

    public Outcome<InstanceView> getActiveInstance(String principalId, String challengeId) {
        return guard("status", () -> lifecycle.status(principalId, challengeId)
                .orElseThrow(() -> new RangeKeeperException(ErrorKind.NOT_FOUND,
                        "No active instance for principal=" + principalId + " challenge=" + challengeId)));
    }

    // Every ineligible submission is answered exactly like a wrong flag.
    public Outcome<FlagVerdict> submitFlag(String instanceId, String principalId, String submitted) {
        return guard("submit-flag", () -> {
            Optional<InstanceRecord> row = instanceId == null ? Optional.empty() : lifecycle.get(instanceId);
            boolean eligible = row.isPresent()
                    && row.get().ownedBy(principalId)
                    && row.get().status() == InstanceStatus.RUNNING
                    && row.get().expiresAtMs() > clock.millis();
            String challengeId = row.map(InstanceRecord::challengeId).orElse(null);
            boolean accepted = eligible
                    ? credentialEngine.validate(instanceId, submitted, principalId, challengeId)
                    : credentialEngine.rejectUnbound(instanceId, submitted, principalId, challengeId);
            return accepted ? FlagVerdict.ACCEPTED : FlagVerdict.REJECTED;
        });
    }

    public Outcome<Integer> rotateKey(String actor) {
        return guard("key-rotate", () -> credentialEngine.rotateKey(actor));
    }

    public Outcome<CredentialEngine.KeyStatus> keyStatus() {
        return guard("key-status", credentialEngine::keyStatus);
    }

    public Outcome<PolicyEntry> setPolicy(String challengeId, long baseRuntimeSeconds, long extensionIncrementSeconds,
                                          int maxExtensions, long maxLifetimeSeconds, String actor) {
        return guard("policy-set", () -> policyResolver.upsert(
                challengeId,
                Policy.ofSeconds(baseRuntimeSeconds, extensionIncrementSeconds, maxExtensions, maxLifetimeSeconds),
                actor
        ));
    }

    public Outcome<Boolean> removePolicy(String challengeId, String actor) {
        return guard("policy-remove", () -> policyResolver.remove(challengeId, actor));
    }

    public Outcome<List<PolicyEntry>> listPolicies() {
        return guard("policy-list", policyResolver::list);
    }

    public Outcome<Policy> resolvePolicy(String challengeId) {
        return guard("policy-resolve", () -> policyResolver.resolve(challengeId));
    }

    public Outcome<List<AuditEntry>> queryAudit(AuditQuery query) {
        return guard("audit-query", () -> auditLog.query(query));
    }

    public Outcome<AuditVerification> verifyAudit() {
        return guard("audit-verify", auditLog::verify);
    }

    public Outcome<Integer> purgeTerminated(Duration olderThan, int limit, String actor) {
        return guard("purge", () -> lifecycle.purgeTerminated(olderThan, limit, actor));
    }

    public SweepSummary sweep() {
        return reaper.sweep();
    }

    public void startReaper() {
        reaper.start();
    }

    public void stopReaper() {
        reaper.stop();
    }

    public StatsOutcome stats() {
        CredentialEngine.KeyStatus keys = credentialEngine.keyStatus();
        ExpiryReaper.Counters counters = reaper.counters();
        return new StatsOutcome(
                config.namespace(),
                instanceStore.countByStatus(),
                keys.credentialsByKeyId(),
                keys.activeKeyId(),
                keys.totalKeys(),
                auditLog.count(),
                auditLog.writeFailures(),
                counters.sweeps(),
                counters.expired(),
                counters.teardownFailures(),
                counters.sweepErrors()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats(), config.namespace());
    }

    @Override
    public void close() {
        reaper.stop();
        gateway.close();
    }

    private InstanceView view(InstanceRecord record) {
        return InstanceView.of(record, policyResolver.resolve(record.challengeId()), clock.millis());
    }

    private <T> Outcome<T> guard(String operation, Supplier<T> work) {
        try {
            return Outcome.ok(work.get());
        } catch (RangeKeeperException e) {
            if (e.kind() == ErrorKind.INTERNAL || e.kind() == ErrorKind.DUPLICATE_BINDING) {
                LOG.error("{} failed: {}", operation, e.getMessage(), e);
            } else {
                LOG.debug("{} rejected kind={}: {}", operation, e.kind(), e.getMessage());
            }
            return Outcome.failed(e.kind(), e.getMessage());
        } catch (PolicyConfigurationException | IllegalArgumentException e) {
            return Outcome.failed(ErrorKind.INVALID_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("{} failed unexpectedly", operation, e);
            return Outcome.failed(ErrorKind.INTERNAL, operation + " failed: " + e.getMessage());
        }
    }

    public record StatsOutcome(
            String namespace,
            Map<String, Integer> instancesByStatus,
            Map<Integer, Integer> credentialsByKeyId,
            int activeKeyId,
            int totalKeys,
            long auditEvents,
            long auditWriteFailures,
            long reaperSweeps,
            long reaperExpired,
            long reaperTeardownFailures,
            long reaperSweepErrors
    ) {
    }
}
