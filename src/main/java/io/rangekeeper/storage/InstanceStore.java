package io.rangekeeper.storage;

import io.rangekeeper.model.CredentialRecord;
import io.rangekeeper.model.InstanceRecord;
import io.rangekeeper.model.InstanceStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative instance rows. Every state-changing write is a conditional update that
 * names the status and {@code version} it expects; a write that loses a race updates zero
 * rows and reports {@code false} instead of overwriting the winner.
 */
public final class InstanceStore {
    private static final String COLUMNS = "instance_id,principal_id,challenge_id,status,workload_handle,created_at_ms,expires_at_ms,"
            + "extension_count,last_extended_at_ms,version,teardown_claim,claimed_at_ms,failure_reason,updated_at_ms,"
            + "teardown_failures,expire_retry_at_ms";

    private static final int MAX_INSERT_ATTEMPTS = 2;

    private final Database database;
    private final CredentialStore credentialStore;
    private final String namespace;

    public InstanceStore(Database database, CredentialStore credentialStore) {
        this.database = database;
        this.credentialStore = credentialStore;
        this.namespace = database.namespace();
    }

    // A loser whose winner already left the active states retries once.
    public InsertOutcome insertProvisioning(NewInstance n) {
        for (int attempt = 1; ; attempt++) {
            try {
                return insertOnce(n);
            } catch (RuntimeException e) {
                if (!isConstraintViolation(e) || get(n.instanceId()).isPresent()) {
                    throw e;
                }
                Optional<InstanceRecord> afterRace = findActive(n.principalId(), n.challengeId());
                if (afterRace.isPresent()) {
                    return InsertOutcome.conflict(afterRace.get());
                }
                if (attempt >= MAX_INSERT_ATTEMPTS) {
                    return InsertOutcome.conflict(null);
                }
            }
        }
    }

    private InsertOutcome insertOnce(NewInstance n) {
        return database.withRetry("instance.insert", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "INSERT INTO instances(instance_id,namespace,principal_id,challenge_id,status,created_at_ms,expires_at_ms,extension_count,version,updated_at_ms) VALUES(?,?,?,?,?,?,?,0,0,?)")) {
                ps.setString(1, n.instanceId());
                ps.setString(2, namespace);
                ps.setString(3, n.principalId());
                ps.setString(4, n.challengeId());
                ps.setString(5, InstanceStatus.PROVISIONING.name());
                ps.setLong(6, n.nowMs());
                ps.setLong(7, n.expiresAtMs());
                ps.setLong(8, n.nowMs());
                ps.executeUpdate();
            }
            return InsertOutcome.inserted(get(n.instanceId()).orElseThrow());
        });
    }

    private static boolean isConstraintViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException && Database.isConstraintViolation((SQLException) t)) {
                return true;
            }
        }
        return false;
    }

    public Optional<InstanceRecord> get(String instanceId) {
        return database.withRetry("instance.get", () -> {
            try (Connection c = database.openConnection()) {
                return get(c, instanceId);
            }
        });
    }

    public Optional<InstanceRecord> findActive(String principalId, String challengeId) {
        return database.withRetry("instance.findActive", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT " + COLUMNS + " FROM instances WHERE namespace=? AND principal_id=? AND challenge_id=? AND status IN ('PROVISIONING','RUNNING')")) {
                ps.setString(1, namespace);
                ps.setString(2, principalId);
                ps.setString(3, challengeId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    // Status change and credential insert commit together.
    public boolean activate(String instanceId, long expectedVersion, String workloadHandle,
                            CredentialRecord credential, long nowMs) {
        return database.withRetry("instance.activate", () -> {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    int updated;
                    try (PreparedStatement ps = c.prepareStatement(
                            "UPDATE instances SET status=?,workload_handle=?,version=version+1,updated_at_ms=? WHERE namespace=? AND instance_id=? AND status=? AND version=?")) {
                        ps.setString(1, InstanceStatus.RUNNING.name());
                        ps.setString(2, workloadHandle);
                        ps.setLong(3, nowMs);
                        ps.setString(4, namespace);
                        ps.setString(5, instanceId);
                        ps.setString(6, InstanceStatus.PROVISIONING.name());
                        ps.setLong(7, expectedVersion);
                        updated = ps.executeUpdate();
                    }
                    if (updated != 1) {
                        c.rollback();
                        return false;
                    }
                    credentialStore.insert(c, credential);
                    c.commit();
                    return true;
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            }
        });
    }

    public boolean markFailed(String instanceId, long expectedVersion, String reason, long nowMs) {
        return database.withRetry("instance.markFailed", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "UPDATE instances SET status=?,failure_reason=?,version=version+1,updated_at_ms=? WHERE namespace=? AND instance_id=? AND status=? AND version=?")) {
                ps.setString(1, InstanceStatus.FAILED.name());
                ps.setString(2, truncate(reason));
                ps.setLong(3, nowMs);
                ps.setString(4, namespace);
                ps.setString(5, instanceId);
                ps.setString(6, InstanceStatus.PROVISIONING.name());
                ps.setLong(7, expectedVersion);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public boolean applyExtension(String instanceId, long expectedVersion, int newExtensionCount,
                                  long newExpiresAtMs, long nowMs) {
        return database.withRetry("instance.extend", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "UPDATE instances SET extension_count=?,expires_at_ms=?,last_extended_at_ms=?,version=version+1,updated_at_ms=? "
                                 + "WHERE namespace=? AND instance_id=? AND status=? AND version=? AND teardown_claim IS NULL AND expires_at_ms<=?")) {
                ps.setInt(1, newExtensionCount);
                ps.setLong(2, newExpiresAtMs);
                ps.setLong(3, nowMs);
                ps.setLong(4, nowMs);
                ps.setString(5, namespace);
                ps.setString(6, instanceId);
                ps.setString(7, InstanceStatus.RUNNING.name());
                ps.setLong(8, expectedVersion);
                ps.setLong(9, newExpiresAtMs);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public boolean claimTeardown(String instanceId, long expectedVersion, String claimToken,
                                 Long dueAtOrBeforeMs, long nowMs) {
        String sql = "UPDATE instances SET teardown_claim=?,claimed_at_ms=?,version=version+1,updated_at_ms=? "
                + "WHERE namespace=? AND instance_id=? AND status=? AND version=? AND teardown_claim IS NULL"
                + (dueAtOrBeforeMs == null ? "" : " AND expires_at_ms<=?");
        return database.withRetry("instance.claimTeardown", () -> {
            try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, claimToken);
                ps.setLong(2, nowMs);
                ps.setLong(3, nowMs);
                ps.setString(4, namespace);
                ps.setString(5, instanceId);
                ps.setString(6, InstanceStatus.RUNNING.name());
                ps.setLong(7, expectedVersion);
                if (dueAtOrBeforeMs != null) {
                    ps.setLong(8, dueAtOrBeforeMs);
                }
                return ps.executeUpdate() == 1;
            }
        });
    }

    public boolean releaseFailedTeardown(String instanceId, String claimToken, long retryAtMs, long nowMs) {
        return database.withRetry("instance.releaseFailedTeardown", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "UPDATE instances SET teardown_claim=NULL,claimed_at_ms=NULL,teardown_failures=teardown_failures+1,"
                                 + "expire_retry_at_ms=?,version=version+1,updated_at_ms=? "
                                 + "WHERE namespace=? AND instance_id=? AND status=? AND teardown_claim=?")) {
                ps.setLong(1, retryAtMs);
                ps.setLong(2, nowMs);
                ps.setString(3, namespace);
                ps.setString(4, instanceId);
                ps.setString(5, InstanceStatus.RUNNING.name());
                ps.setString(6, claimToken);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public boolean terminate(String instanceId, String claimToken, long nowMs) {
        return database.withRetry("instance.terminate", () -> {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    int updated;
                    try (PreparedStatement ps = c.prepareStatement(
                            "UPDATE instances SET status=?,teardown_claim=NULL,claimed_at_ms=NULL,version=version+1,updated_at_ms=? "
                                    + "WHERE namespace=? AND instance_id=? AND status=? AND teardown_claim=?")) {
                        ps.setString(1, InstanceStatus.TERMINATED.name());
                        ps.setLong(2, nowMs);
                        ps.setString(3, namespace);
                        ps.setString(4, instanceId);
                        ps.setString(5, InstanceStatus.RUNNING.name());
                        ps.setString(6, claimToken);
                        updated = ps.executeUpdate();
                    }
                    if (updated != 1) {
                        c.rollback();
                        return false;
                    }
                    credentialStore.delete(c, instanceId);
                    c.commit();
                    return true;
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            }
        });
    }

    // A row whose teardown failed sorts by its retry time, behind deadlines that passed before it.
    public List<String> listExpiredRunning(long nowMs, int limit) {
        return database.withRetry("instance.listExpired", () -> {
            List<String> out = new ArrayList<>();
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT instance_id FROM instances WHERE namespace=? AND status=? AND expires_at_ms<=? AND teardown_claim IS NULL "
                                 + "AND (expire_retry_at_ms IS NULL OR expire_retry_at_ms<=?) "
                                 + "ORDER BY COALESCE(expire_retry_at_ms, expires_at_ms) ASC, expires_at_ms ASC LIMIT ?")) {
                ps.setString(1, namespace);
                ps.setString(2, InstanceStatus.RUNNING.name());
                ps.setLong(3, nowMs);
                ps.setLong(4, nowMs);
                ps.setInt(5, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(rs.getString("instance_id"));
                    }
                }
            }
            return out;
        });
    }

    public List<String> releaseStaleClaims(long cutoffMs, long nowMs) {
        return database.withRetry("instance.releaseStaleClaims", () -> {
            List<String> released = new ArrayList<>();
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    try (PreparedStatement sel = c.prepareStatement(
                            "SELECT instance_id FROM instances WHERE namespace=? AND status=? AND teardown_claim IS NOT NULL AND claimed_at_ms<=?")) {
                        sel.setString(1, namespace);
                        sel.setString(2, InstanceStatus.RUNNING.name());
                        sel.setLong(3, cutoffMs);
                        try (ResultSet rs = sel.executeQuery()) {
                            while (rs.next()) {
                                released.add(rs.getString("instance_id"));
                            }
                        }
                    }
                    try (PreparedStatement upd = c.prepareStatement(
                            "UPDATE instances SET teardown_claim=NULL,claimed_at_ms=NULL,version=version+1,updated_at_ms=? "
                                    + "WHERE namespace=? AND instance_id=? AND status=? AND claimed_at_ms<=?")) {
                        for (String id : released) {
                            upd.setLong(1, nowMs);
                            upd.setString(2, namespace);
                            upd.setString(3, id);
                            upd.setString(4, InstanceStatus.RUNNING.name());
                            upd.setLong(5, cutoffMs);
                            upd.executeUpdate();
                        }
                    }
                    c.commit();
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            }
            return released;
        });
    }

    public List<InstanceRecord> purgeTerminal(long cutoffMs, int limit) {
        return database.withRetry("instance.purge", () -> {
            List<InstanceRecord> purged = new ArrayList<>();
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    try (PreparedStatement sel = c.prepareStatement(
                            "SELECT " + COLUMNS + " FROM instances WHERE namespace=? AND status IN ('TERMINATED','FAILED') AND updated_at_ms<=? ORDER BY updated_at_ms LIMIT ?")) {
                        sel.setString(1, namespace);
                        sel.setLong(2, cutoffMs);
                        sel.setInt(3, Math.max(1, limit));
                        try (ResultSet rs = sel.executeQuery()) {
                            while (rs.next()) {
                                purged.add(map(rs));
                            }
                        }
                    }
                    try (PreparedStatement del = c.prepareStatement(
                            "DELETE FROM instances WHERE namespace=? AND instance_id=? AND status IN ('TERMINATED','FAILED')")) {
                        for (InstanceRecord r : purged) {
                            del.setString(1, namespace);
                            del.setString(2, r.instanceId());
                            del.executeUpdate();
                        }
                    }
                    c.commit();
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            }
            return purged;
        });
    }

    public Map<String, Integer> countByStatus() {
        return database.withRetry("instance.countByStatus", () -> {
            Map<String, Integer> out = new LinkedHashMap<>();
            for (InstanceStatus s : InstanceStatus.values()) {
                out.put(s.name(), 0);
            }
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT status, COUNT(*) AS n FROM instances WHERE namespace=? GROUP BY status")) {
                ps.setString(1, namespace);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.put(rs.getString("status"), rs.getInt("n"));
                    }
                }
            }
            return out;
        });
    }

    private Optional<InstanceRecord> get(Connection c, String instanceId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM instances WHERE namespace=? AND instance_id=?")) {
            ps.setString(1, namespace);
            ps.setString(2, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private InstanceRecord map(ResultSet rs) throws SQLException {
        return new InstanceRecord(
                rs.getString("instance_id"),
                rs.getString("principal_id"),
                rs.getString("challenge_id"),
                InstanceStatus.fromString(rs.getString("status")),
                rs.getString("workload_handle"),
                rs.getLong("created_at_ms"),
                rs.getLong("expires_at_ms"),
                rs.getInt("extension_count"),
                rs.getObject("last_extended_at_ms") == null ? null : rs.getLong("last_extended_at_ms"),
                rs.getLong("version"),
                rs.getString("teardown_claim"),
                rs.getObject("claimed_at_ms") == null ? null : rs.getLong("claimed_at_ms"),
                rs.getString("failure_reason"),
                rs.getLong("updated_at_ms"),
                rs.getInt("teardown_failures"),
                rs.getObject("expire_retry_at_ms") == null ? null : rs.getLong("expire_retry_at_ms")
        );
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.length() <= 512 ? raw : raw.substring(0, 512) + "...";
    }

    public record NewInstance(String instanceId, String principalId, String challengeId, long expiresAtMs, long nowMs) {
    }

    // On conflict, record is the active row when one was still visible, otherwise null.
    public record InsertOutcome(InstanceRecord record, boolean conflict) {
        public static InsertOutcome inserted(InstanceRecord record) {
            return new InsertOutcome(record, false);
        }

        public static InsertOutcome conflict(InstanceRecord existing) {
            return new InsertOutcome(existing, true);
        }
    }
}
