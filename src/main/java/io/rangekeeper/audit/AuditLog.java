package io.rangekeeper.audit;

import io.rangekeeper.security.SensitiveDataMasker;
import io.rangekeeper.storage.Database;
import io.rangekeeper.util.Hashing;
import io.rangekeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public final class AuditLog {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLog.class);
    private static final String COLUMNS = "id,occurred_at_ms,action,actor,principal_id,instance_id,challenge_id,detail_json,prev_hash,hash,signature";

    private final Database database;
    private final String namespace;
    private final String signingSecret;
    private final Clock clock;
    private final AtomicLong writeFailures = new AtomicLong();
    private final Object appendLock = new Object();

    public AuditLog(Database database, String signingSecret, Clock clock) {
        this.database = database;
        this.namespace = database.namespace();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
    }

    public void record(AuditEvent event) {
        try {
            append(event);
        } catch (RuntimeException e) {
            long failures = writeFailures.incrementAndGet();
            LOG.error("Audit write failed action={} instance={} failures={}",
                    event == null ? null : event.action(),
                    event == null ? null : event.instanceId(),
                    failures,
                    e);
        }
    }

    public long writeFailures() {
        return writeFailures.get();
    }

    private void append(AuditEvent event) {
        long now = clock.millis();
        String detailJson = Jsons.toCompactJson(SensitiveDataMasker.masked(Jsons.mapper().valueToTree(event.details())));
        // The in-process lock keeps our own writers ordered; BEGIN IMMEDIATE covers other processes.
        synchronized (appendLock) {
            database.withRetry("audit.append", () -> {
                try (Connection c = database.openConnection()) {
                    c.setAutoCommit(false);
                    try {
                        String prevHash = lastHash(c);
                        Map<String, Object> row = canonicalRow(now, event.action().wireName(), event.actor(),
                                event.principalId(), event.instanceId(), event.challengeId(), detailJson, prevHash);
                        String hash = Hashing.sha256Hex(Jsons.toCompactJson(row));
                        String signature = signingSecret.isBlank() ? null : Hashing.hmacSha256Hex(signingSecret, hash);
                        try (PreparedStatement ps = c.prepareStatement(
                                "INSERT INTO audit_events(namespace,occurred_at_ms,action,actor,principal_id,instance_id,challenge_id,detail_json,prev_hash,hash,signature) "
                                        + "VALUES(?,?,?,?,?,?,?,?,?,?,?)")) {
                            ps.setString(1, namespace);
                            ps.setLong(2, now);
                            ps.setString(3, event.action().wireName());
                            ps.setString(4, event.actor());
                            ps.setString(5, event.principalId());
                            ps.setString(6, event.instanceId());
                            ps.setString(7, event.challengeId());
                            ps.setString(8, detailJson);
                            ps.setString(9, prevHash);
                            ps.setString(10, hash);
                            ps.setString(11, signature);
                            ps.executeUpdate();
                        }
                        c.commit();
                        return null;
                    } catch (SQLException | RuntimeException e) {
                        c.rollback();
                        throw e;
                    } finally {
                        c.setAutoCommit(true);
                    }
                }
            });
        }
    }

    public List<AuditEntry> query(AuditQuery query) {
        AuditQuery q = query == null ? AuditQuery.all() : query;
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM audit_events WHERE namespace=?");
        List<Object> args = new ArrayList<>();
        args.add(namespace);
        if (q.principalId() != null) {
            sql.append(" AND principal_id=?");
            args.add(q.principalId());
        }
        if (q.challengeId() != null) {
            sql.append(" AND challenge_id=?");
            args.add(q.challengeId());
        }
        if (q.instanceId() != null) {
            sql.append(" AND instance_id=?");
            args.add(q.instanceId());
        }
        if (q.action() != null) {
            sql.append(" AND action=?");
            args.add(q.action().wireName());
        }
        if (q.sinceMs() != null) {
            sql.append(" AND occurred_at_ms>=?");
            args.add(q.sinceMs());
        }
        if (q.untilMs() != null) {
            sql.append(" AND occurred_at_ms<=?");
            args.add(q.untilMs());
        }
        sql.append(" ORDER BY id ASC LIMIT ?");
        args.add(q.limit());
        return database.withRetry("audit.query", () -> {
            List<AuditEntry> out = new ArrayList<>();
            try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
                for (int i = 0; i < args.size(); i++) {
                    ps.setObject(i + 1, args.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new AuditEntry(
                                rs.getLong("id"),
                                rs.getLong("occurred_at_ms"),
                                rs.getString("action"),
                                rs.getString("actor"),
                                rs.getString("principal_id"),
                                rs.getString("instance_id"),
                                rs.getString("challenge_id"),
                                Jsons.toMap(rs.getString("detail_json")),
                                rs.getString("prev_hash"),
                                rs.getString("hash")
                        ));
                    }
                }
            }
            return out;
        });
    }

    public AuditVerification verify() {
        return database.withRetry("audit.verify", () -> {
            int total = 0;
            int checked = 0;
            long brokenAt = 0L;
            String reason = "";
            String expectedPrev = "";
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT " + COLUMNS + " FROM audit_events WHERE namespace=? ORDER BY id ASC")) {
                ps.setString(1, namespace);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        total++;
                        if (brokenAt != 0L) {
                            continue;
                        }
                        long id = rs.getLong("id");
                        String hash = rs.getString("hash");
                        String prevHash = rs.getString("prev_hash");
                        if (!expectedPrev.equals(prevHash)) {
                            brokenAt = id;
                            reason = "prev_hash_mismatch";
                            continue;
                        }
                        Map<String, Object> row = canonicalRow(
                                rs.getLong("occurred_at_ms"),
                                rs.getString("action"),
                                rs.getString("actor"),
                                rs.getString("principal_id"),
                                rs.getString("instance_id"),
                                rs.getString("challenge_id"),
                                rs.getString("detail_json"),
                                prevHash
                        );
                        if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                            brokenAt = id;
                            reason = "hash_mismatch";
                            continue;
                        }
                        String signature = rs.getString("signature");
                        if (!signingSecret.isBlank()
                                && (signature == null || !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature))) {
                            brokenAt = id;
                            reason = "signature_mismatch";
                            continue;
                        }
                        checked++;
                        expectedPrev = hash;
                    }
                }
            }
            return new AuditVerification(brokenAt == 0L, total, checked, brokenAt, reason, expectedPrev);
        });
    }

    public long count() {
        return database.withRetry("audit.count", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM audit_events WHERE namespace=?")) {
                ps.setString(1, namespace);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    private String lastHash(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT hash FROM audit_events WHERE namespace=? ORDER BY id DESC LIMIT 1")) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : "";
            }
        }
    }

    private Map<String, Object> canonicalRow(long occurredAtMs, String action, String actor, String principalId,
                                             String instanceId, String challengeId, String detailJson, String prevHash) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("occurred_at_ms", occurredAtMs);
        row.put("namespace", namespace);
        row.put("action", action);
        row.put("actor", actor);
        row.put("principal_id", principalId);
        row.put("instance_id", instanceId);
        row.put("challenge_id", challengeId);
        row.put("details", detailJson);
        row.put("prev_hash", prevHash);
        return row;
    }

    public static String loadOrCreateSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String secret = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, secret, StandardCharsets.UTF_8);
            return secret;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing key: " + keyFile, e);
        }
    }
}
