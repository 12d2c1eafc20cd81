package io.rangekeeper.storage;

import io.rangekeeper.model.CredentialRecord;
import io.rangekeeper.model.InstanceRecord;
import io.rangekeeper.model.InstanceStatus;
import io.rangekeeper.testing.Harness;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class InstanceStoreTest {

    @Test
    void activeRowIsUniquePerPrincipalAndChallenge() throws Exception {
        try (Harness h = Harness.create()) {
            InstanceStore store = h.instanceStore;
            long now = h.clock.millis();

            InstanceStore.InsertOutcome first = store.insertProvisioning(new InstanceStore.NewInstance("i-1", "alice", "web-101", now + 1_000L, now));
            Assertions.assertFalse(first.conflict());
            Assertions.assertEquals(InstanceStatus.PROVISIONING, first.record().status());
            Assertions.assertEquals(0L, first.record().version());

            InstanceStore.InsertOutcome second = store.insertProvisioning(new InstanceStore.NewInstance("i-2", "alice", "web-101", now + 1_000L, now));
            Assertions.assertTrue(second.conflict());
            Assertions.assertEquals("i-1", second.record().instanceId());
            Assertions.assertTrue(store.get("i-2").isEmpty());

            Assertions.assertTrue(store.markFailed("i-1", 0L, "provisioner_rejected", now));
            InstanceStore.InsertOutcome third = store.insertProvisioning(new InstanceStore.NewInstance("i-3", "alice", "web-101", now + 1_000L, now));
            Assertions.assertFalse(third.conflict());
            Assertions.assertEquals("provisioner_rejected", store.get("i-1").orElseThrow().failureReason());
        }
    }

    @Test
    void activationIsConditionalOnVersionAndStoresTheCredential() throws Exception {
        try (Harness h = Harness.create()) {
            InstanceStore store = h.instanceStore;
            long now = h.clock.millis();
            store.insertProvisioning(new InstanceStore.NewInstance("i-1", "alice", "web-101", now + 1_000L, now));
            CredentialRecord credential = new CredentialRecord("i-1", "gcm1:AAAA", 1, now);

            Assertions.assertFalse(store.activate("i-1", 7L, "h-1", credential, now));
            Assertions.assertTrue(h.credentialStore.find("i-1").isEmpty());

            Assertions.assertTrue(store.activate("i-1", 0L, "h-1", credential, now));
            InstanceRecord running = store.get("i-1").orElseThrow();
            Assertions.assertEquals(InstanceStatus.RUNNING, running.status());
            Assertions.assertEquals("h-1", running.workloadHandle());
            Assertions.assertEquals(1L, running.version());
            Assertions.assertTrue(h.credentialStore.find("i-1").isPresent());

            Assertions.assertFalse(store.activate("i-1", 1L, "h-2", credential, now));
            Assertions.assertFalse(store.markFailed("i-1", 1L, "late", now));
        }
    }

    @Test
    void claimFencesExtensionAndTerminateDropsCredential() throws Exception {
        try (Harness h = Harness.create()) {
            InstanceStore store = h.instanceStore;
            long now = h.clock.millis();
            store.insertProvisioning(new InstanceStore.NewInstance("i-1", "alice", "web-101", now + 1_000L, now));
            store.activate("i-1", 0L, "h-1", new CredentialRecord("i-1", "gcm1:AAAA", 1, now), now);

            Assertions.assertFalse(store.claimTeardown("i-1", 1L, "claim-a", now, now));
            Assertions.assertTrue(store.claimTeardown("i-1", 1L, "claim-a", null, now));
            Assertions.assertFalse(store.claimTeardown("i-1", 2L, "claim-b", null, now));
            Assertions.assertFalse(store.applyExtension("i-1", 2L, 1, now + 2_000L, now));
            Assertions.assertTrue(store.listExpiredRunning(now + 5_000L, 10).isEmpty());

            Assertions.assertFalse(store.terminate("i-1", "claim-b", now));
            Assertions.assertTrue(store.terminate("i-1", "claim-a", now));
            InstanceRecord done = store.get("i-1").orElseThrow();
            Assertions.assertEquals(InstanceStatus.TERMINATED, done.status());
            Assertions.assertFalse(done.claimed());
            Assertions.assertTrue(h.credentialStore.find("i-1").isEmpty());
        }
    }

    @Test
    void extensionNeverShortensDeadline() throws Exception {
        try (Harness h = Harness.create()) {
            InstanceStore store = h.instanceStore;
            long now = h.clock.millis();
            store.insertProvisioning(new InstanceStore.NewInstance("i-1", "alice", "web-101", now + 10_000L, now));
            store.activate("i-1", 0L, "h-1", new CredentialRecord("i-1", "gcm1:AAAA", 1, now), now);

            Assertions.assertFalse(store.applyExtension("i-1", 1L, 1, now + 5_000L, now));
            Assertions.assertTrue(store.applyExtension("i-1", 1L, 1, now + 20_000L, now));
            InstanceRecord r = store.get("i-1").orElseThrow();
            Assertions.assertEquals(now + 20_000L, r.expiresAtMs());
            Assertions.assertEquals(1, r.extensionCount());
            Assertions.assertEquals(now, r.lastExtendedAtMs());
        }
    }

    @Test
    void expiredListingIsOrderedByDeadline() throws Exception {
        try (Harness h = Harness.create()) {
            InstanceStore store = h.instanceStore;
            long now = h.clock.millis();
            String[] ids = {"i-late", "i-early", "i-future"};
            long[] deadlines = {now - 1_000L, now - 5_000L, now + 5_000L};
            for (int i = 0; i < ids.length; i++) {
                store.insertProvisioning(new InstanceStore.NewInstance(ids[i], "p-" + i, "web-101", deadlines[i], now - 10_000L));
                store.activate(ids[i], 0L, "h-" + i, new CredentialRecord(ids[i], "gcm1:AAAA", 1, now), now);
            }
            Assertions.assertEquals(List.of("i-early", "i-late"), store.listExpiredRunning(now, 10));
            Assertions.assertEquals(List.of("i-early"), store.listExpiredRunning(now, 1));
            Assertions.assertEquals(3, store.countByStatus().get("RUNNING"));
        }
    }

    @Test
    void failedTeardownMovesTheRowBehindLaterDeadlines() throws Exception {
        try (Harness h = Harness.create()) {
            InstanceStore store = h.instanceStore;
            long now = h.clock.millis();
            String[] ids = {"i-stuck", "i-next"};
            long[] deadlines = {now - 5_000L, now - 1_000L};
            for (int i = 0; i < ids.length; i++) {
                store.insertProvisioning(new InstanceStore.NewInstance(ids[i], "p-" + i, "web-101", deadlines[i], now - 10_000L));
                store.activate(ids[i], 0L, "h-" + i, new CredentialRecord(ids[i], "gcm1:AAAA", 1, now), now);
            }
            Assertions.assertEquals(List.of("i-stuck", "i-next"), store.listExpiredRunning(now, 10));

            Assertions.assertTrue(store.claimTeardown("i-stuck", 1L, "claim-1", now, now));
            Assertions.assertFalse(store.releaseFailedTeardown("i-stuck", "other-claim", now + 30_000L, now));
            Assertions.assertTrue(store.releaseFailedTeardown("i-stuck", "claim-1", now + 30_000L, now));

            InstanceRecord stuck = store.get("i-stuck").orElseThrow();
            Assertions.assertFalse(stuck.claimed());
            Assertions.assertEquals(1, stuck.teardownFailures());
            Assertions.assertEquals(now + 30_000L, stuck.expireRetryAtMs());

            Assertions.assertEquals(List.of("i-next"), store.listExpiredRunning(now, 10));
            Assertions.assertEquals(List.of("i-next", "i-stuck"), store.listExpiredRunning(now + 30_000L, 10));
            Assertions.assertEquals(List.of("i-next"), store.listExpiredRunning(now + 30_000L, 1));
        }
    }

    @Test
    void reusedInstanceIdIsAStoreErrorNotAConflict() throws Exception {
        try (Harness h = Harness.create()) {
            InstanceStore store = h.instanceStore;
            long now = h.clock.millis();
            store.insertProvisioning(new InstanceStore.NewInstance("i-dup", "alice", "web-101", now + 1_000L, now));
            Assertions.assertThrows(RuntimeException.class,
                    () -> store.insertProvisioning(new InstanceStore.NewInstance("i-dup", "bob", "web-101", now + 1_000L, now)));
            Assertions.assertEquals("alice", store.get("i-dup").orElseThrow().principalId());
        }
    }

    @Test
    void schemaMigrationsAreRecordedOnce() throws Exception {
        try (Harness h = Harness.create()) {
            int before = h.database.listSchemaMigrations().size();
            h.database.init();
            List<Database.SchemaMigrationRow> rows = h.database.listSchemaMigrations();
            Assertions.assertEquals(before, rows.size());
            Assertions.assertTrue(rows.stream().allMatch(Database.SchemaMigrationRow::success));
            Assertions.assertTrue(rows.stream().anyMatch(r -> r.version().endsWith("claim_sweep_index")));
        }
    }
}
