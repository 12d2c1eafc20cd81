package io.rangekeeper.security;

import io.rangekeeper.audit.AuditEntry;
import io.rangekeeper.audit.AuditQuery;
import io.rangekeeper.error.RangeKeeperException;
import io.rangekeeper.model.AuditAction;
import io.rangekeeper.model.CredentialRecord;
import io.rangekeeper.model.ErrorKind;
import io.rangekeeper.storage.InstanceStore;
import io.rangekeeper.testing.Harness;
import io.rangekeeper.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.List;
import java.util.Map;

final class CredentialEngineTest {

    @Test
    void issuedCredentialValidatesAcrossKeyRotation() throws Exception {
        try (Harness h = Harness.create()) {
            instance(h, "inst-a", "alice");
            CredentialEngine.IssuedCredential a = h.credentials.issue("inst-a");
            Assertions.assertEquals(1, a.record().keyId());
            Assertions.assertTrue(a.record().ciphertext().startsWith(FlagCipher.CIPHERTEXT_PREFIX));
            Assertions.assertFalse(a.record().ciphertext().contains(a.secret().value()));
            Assertions.assertTrue(a.secret().value().startsWith("FLAG{"));

            Assertions.assertEquals(2, h.credentials.rotateKey("admin:ops"));

            instance(h, "inst-b", "bob");
            CredentialEngine.IssuedCredential b = h.credentials.issue("inst-b");
            Assertions.assertEquals(2, b.record().keyId());

            Assertions.assertTrue(h.credentials.validate("inst-a", a.secret().value()));
            Assertions.assertTrue(h.credentials.validate("inst-b", b.secret().value()));
            Assertions.assertFalse(h.credentials.validate("inst-a", b.secret().value()));
            Assertions.assertFalse(h.credentials.validate("inst-b", "FLAG{nope}"));

            CredentialEngine.KeyStatus status = h.credentials.keyStatus();
            Assertions.assertEquals(2, status.activeKeyId());
            Assertions.assertEquals(2, status.totalKeys());
            Assertions.assertEquals(Map.of(1, 1, 2, 1), status.credentialsByKeyId());

            List<AuditEntry> rotations = h.auditLog.query(AuditQuery.all().withAction(AuditAction.KEY_ROTATED));
            Assertions.assertEquals(1, rotations.size());
            Assertions.assertEquals("admin:ops", rotations.get(0).actor());
            Assertions.assertEquals(1, ((Number) rotations.get(0).details().get("previous_key_id")).intValue());
            Assertions.assertEquals(2, ((Number) rotations.get(0).details().get("key_id")).intValue());
        }
    }

    @Test
    void secondIssueForSameInstanceIsDuplicateBinding() throws Exception {
        try (Harness h = Harness.create()) {
            instance(h, "inst-a", "alice");
            CredentialEngine.IssuedCredential first = h.credentials.issue("inst-a");

            RangeKeeperException e = Assertions.assertThrows(RangeKeeperException.class, () -> h.credentials.issue("inst-a"));
            Assertions.assertEquals(ErrorKind.DUPLICATE_BINDING, e.kind());
            Assertions.assertEquals(1L, h.auditCount(AuditAction.INVARIANT_VIOLATION, "inst-a"));
            Assertions.assertTrue(h.credentials.validate("inst-a", first.secret().value()));
        }
    }

    @Test
    void revokedCredentialNoLongerValidates() throws Exception {
        try (Harness h = Harness.create()) {
            instance(h, "inst-a", "alice");
            String flag = h.credentials.issue("inst-a").secret().value();

            Assertions.assertTrue(h.credentials.revoke("inst-a"));
            Assertions.assertFalse(h.credentials.revoke("inst-a"));
            Assertions.assertFalse(h.credentials.validate("inst-a", flag));
            Assertions.assertEquals(1L, h.auditCount(AuditAction.FLAG_REVOKED, "inst-a"));
        }
    }

    @Test
    void missingOrBlankInputsAreRejectedNotThrown() throws Exception {
        try (Harness h = Harness.create()) {
            Assertions.assertFalse(h.credentials.validate("never-issued", "FLAG{x}"));
            Assertions.assertFalse(h.credentials.validate(null, "FLAG{x}"));
            Assertions.assertFalse(h.credentials.validate("never-issued", null));
            Assertions.assertFalse(h.credentials.validate("", ""));
            Assertions.assertEquals(4L, h.auditCount(AuditAction.FLAG_REJECTED));
        }
    }

    @Test
    void tamperedCiphertextFailsClosed() throws Exception {
        try (Harness h = Harness.create()) {
            instance(h, "inst-a", "alice");
            String flag = h.credentials.issue("inst-a").secret().value();
            String ciphertext = h.credentialStore.find("inst-a").orElseThrow().ciphertext();

            int at = ciphertext.length() - 5;
            char flipped = ciphertext.charAt(at) == 'A' ? 'B' : 'A';
            setCiphertext(h, "inst-a", ciphertext.substring(0, at) + flipped + ciphertext.substring(at + 1));
            Assertions.assertFalse(h.credentials.validate("inst-a", flag));

            setCiphertext(h, "inst-a", "not-a-ciphertext");
            Assertions.assertFalse(h.credentials.validate("inst-a", flag));
        }
    }

    @Test
    void ciphertextIsBoundToItsInstance() throws Exception {
        try (Harness h = Harness.create()) {
            instance(h, "inst-a", "alice");
            instance(h, "inst-b", "bob");
            String flagA = h.credentials.issue("inst-a").secret().value();
            h.credentials.issue("inst-b");

            setCiphertext(h, "inst-b", h.credentialStore.find("inst-a").orElseThrow().ciphertext());
            Assertions.assertFalse(h.credentials.validate("inst-b", flagA));
            Assertions.assertTrue(h.credentials.validate("inst-a", flagA));
        }
    }

    @Test
    void credentialUnderForeignKeyringFailsClosed() throws Exception {
        try (Harness h = Harness.create()) {
            instance(h, "inst-a", "alice");
            String flag = h.credentials.issue("inst-a").secret().value();

            Path otherRing = h.root.resolve("other").resolve("flag-keys.json");
            CredentialEngine foreign = new CredentialEngine(h.credentialStore, new FileKeyProvider(otherRing),
                    new FlagCipher(), new FlagGenerator("FLAG", "<hex>"), h.auditLog, h.clock);
            Assertions.assertFalse(foreign.validate("inst-a", flag));
            Assertions.assertTrue(h.credentials.validate("inst-a", flag));
        }
    }

    @Test
    void auditTrailNeverContainsPlaintextOrCiphertext() throws Exception {
        try (Harness h = Harness.create()) {
            instance(h, "inst-a", "alice");
            String flag = h.credentials.issue("inst-a").secret().value();
            String ciphertext = h.credentialStore.find("inst-a").orElseThrow().ciphertext();
            h.credentials.validate("inst-a", flag, "alice", "web-101");
            h.credentials.validate("inst-a", flag + "x", "alice", "web-101");
            h.credentials.rejectUnbound("inst-a", flag, "mallory", "web-101");

            String dump = Jsons.toCompactJson(h.auditLog.query(AuditQuery.all()));
            Assertions.assertFalse(dump.contains(flag));
            Assertions.assertFalse(dump.contains(ciphertext.substring(FlagCipher.CIPHERTEXT_PREFIX.length())));
            Assertions.assertEquals(1L, h.auditCount(AuditAction.FLAG_VALIDATED));
            Assertions.assertEquals(2L, h.auditCount(AuditAction.FLAG_REJECTED));
        }
    }

    @Test
    void sealDoesNotStore() throws Exception {
        try (Harness h = Harness.create()) {
            instance(h, "inst-a", "alice");
            CredentialRecord sealed = h.credentials.seal("inst-a", h.credentials.mint(null));
            Assertions.assertEquals(1, sealed.keyId());
            Assertions.assertTrue(h.credentialStore.find("inst-a").isEmpty());
        }
    }

    private static void instance(Harness h, String instanceId, String principalId) {
        long now = h.clock.millis();
        h.instanceStore.insertProvisioning(new InstanceStore.NewInstance(instanceId, principalId, "web-101", now + 900_000L, now));
    }

    private static void setCiphertext(Harness h, String instanceId, String ciphertext) throws Exception {
        try (Connection c = h.database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE credentials SET ciphertext=? WHERE instance_id=?")) {
            ps.setString(1, ciphertext);
            ps.setString(2, instanceId);
            Assertions.assertEquals(1, ps.executeUpdate());
        }
    }
}
