package io.rangekeeper.security;

import io.rangekeeper.audit.AuditEvent;
import io.rangekeeper.audit.AuditLog;
import io.rangekeeper.error.RangeKeeperException;
import io.rangekeeper.model.AuditAction;
import io.rangekeeper.model.CredentialRecord;
import io.rangekeeper.model.ErrorKind;
import io.rangekeeper.storage.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Issues, validates and revokes the flag bound to an instance.
 *
 * <p>Plaintext flags only exist in memory: they are sealed with the provider's current key
 * before they reach the store, and decrypted again with whatever key id the stored row
 * names. Validation never throws and answers {@code false} for every failure mode, so a
 * caller cannot tell a wrong guess from a missing or unreadable credential.
 */
public final class CredentialEngine {
    private static final Logger LOG = LoggerFactory.getLogger(CredentialEngine.class);

    private final CredentialStore store;
    private final KeyProvider keyProvider;
    private final FlagCipher cipher;
    private final FlagGenerator generator;
    private final AuditLog auditLog;
    private final Clock clock;

    public CredentialEngine(CredentialStore store, KeyProvider keyProvider, FlagCipher cipher,
                            FlagGenerator generator, AuditLog auditLog, Clock clock) {
        this.store = store;
        this.keyProvider = keyProvider;
        this.cipher = cipher;
        this.generator = generator;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public FlagSecret mint(String template) {
        return generator.mint(template);
    }

    public CredentialRecord seal(String instanceId, FlagSecret secret) {
        KeyProvider.ActiveKey active = keyProvider.current();
        String ciphertext = cipher.encrypt(active.key(), instanceId, secret.value());
        return new CredentialRecord(instanceId, ciphertext, active.keyId(), clock.millis());
    }

    public IssuedCredential issue(String instanceId) {
        return issue(instanceId, generator.mint(null));
    }

    public IssuedCredential issue(String instanceId, FlagSecret secret) {
        CredentialRecord record = seal(instanceId, secret);
        try {
            store.insert(record);
        } catch (RangeKeeperException e) {
            if (e.kind() == ErrorKind.DUPLICATE_BINDING) {
                reportDuplicateBinding(instanceId, null, null);
            }
            throw e;
        }
        auditLog.record(AuditEvent.of(AuditAction.FLAG_ISSUED, "system", null, instanceId, null,
                Map.of("key_id", record.keyId())));
        LOG.debug("Issued credential instance={} keyId={} flag={}", instanceId, record.keyId(), secret.redacted());
        return new IssuedCredential(record, secret);
    }

    public void reportDuplicateBinding(String instanceId, String principalId, String challengeId) {
        LOG.error("CRITICAL invariant violation: credential already bound to instance={}", instanceId);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("violation", "duplicate_binding");
        auditLog.record(AuditEvent.of(AuditAction.INVARIANT_VIOLATION, "system", principalId, instanceId, challengeId, details));
    }

    public boolean validate(String instanceId, String submitted) {
        return validate(instanceId, submitted, null, null);
    }

    public boolean validate(String instanceId, String submitted, String principalId, String challengeId) {
        boolean accepted = check(instanceId, submitted);
        auditLog.record(AuditEvent.of(
                accepted ? AuditAction.FLAG_VALIDATED : AuditAction.FLAG_REJECTED,
                principalId == null ? "system" : "principal:" + principalId,
                principalId,
                instanceId,
                challengeId,
                Map.of()
        ));
        return accepted;
    }

    public boolean rejectUnbound(String instanceId, String submitted, String principalId, String challengeId) {
        boolean result = FlagComparator.decoy(submitted);
        auditLog.record(AuditEvent.of(
                AuditAction.FLAG_REJECTED,
                principalId == null ? "system" : "principal:" + principalId,
                principalId,
                instanceId,
                challengeId,
                Map.of("bound", false)
        ));
        return result;
    }

    private boolean check(String instanceId, String submitted) {
        if (instanceId == null || instanceId.isBlank() || submitted == null) {
            return FlagComparator.decoy(submitted);
        }
        Optional<CredentialRecord> stored;
        try {
            stored = store.find(instanceId);
        } catch (RuntimeException e) {
            LOG.warn("Credential lookup failed for instance={}: {}", instanceId, e.getMessage());
            return FlagComparator.decoy(submitted);
        }
        if (stored.isEmpty()) {
            return FlagComparator.decoy(submitted);
        }
        CredentialRecord record = stored.get();
        Optional<SecretKey> key = keyProvider.key(record.keyId());
        if (key.isEmpty()) {
            LOG.error("CRITICAL credential for instance={} references unknown key id={}", instanceId, record.keyId());
            return FlagComparator.decoy(submitted);
        }
        String expected;
        try {
            expected = cipher.decrypt(key.get(), instanceId, record.ciphertext());
        } catch (GeneralSecurityException e) {
            LOG.error("Credential for instance={} failed authentication under key id={}: {}",
                    instanceId, record.keyId(), e.getMessage());
            return FlagComparator.decoy(submitted);
        }
        return FlagComparator.matches(expected, submitted);
    }

    public boolean revoke(String instanceId) {
        boolean removed = store.delete(instanceId);
        if (removed) {
            auditLog.record(AuditEvent.of(AuditAction.FLAG_REVOKED, "system", null, instanceId, null, Map.of()));
        }
        return removed;
    }

    public int rotateKey() {
        return rotateKey("system");
    }

    public int rotateKey(String actor) {
        int previous = keyProvider.currentKeyId();
        int keyId = keyProvider.rotate();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous_key_id", previous);
        details.put("key_id", keyId);
        auditLog.record(AuditEvent.of(AuditAction.KEY_ROTATED, actor, null, null, null, details));
        return keyId;
    }

    public KeyStatus keyStatus() {
        KeyProvider.KeyringStatus status = keyProvider.status();
        return new KeyStatus(status.activeKeyId(), status.totalKeys(), status.location(), store.countByKey());
    }

    public record IssuedCredential(CredentialRecord record, FlagSecret secret) {
    }

    public record KeyStatus(int activeKeyId, int totalKeys, String location, Map<Integer, Integer> credentialsByKeyId) {
    }
}
