package io.rangekeeper.storage;

import io.rangekeeper.model.PolicyEntry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class PolicyStore {
    private static final String COLUMNS = "challenge_id,base_runtime_seconds,extension_increment_seconds,max_extensions,max_lifetime_seconds,updated_by,updated_at_ms";

    private final Database database;
    private final String namespace;

    public PolicyStore(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    public void upsert(PolicyEntry entry) {
        database.withRetry("policy.upsert", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "INSERT INTO runtime_policies(namespace," + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?) "
                                 + "ON CONFLICT(namespace, challenge_id) DO UPDATE SET "
                                 + "base_runtime_seconds=excluded.base_runtime_seconds,"
                                 + "extension_increment_seconds=excluded.extension_increment_seconds,"
                                 + "max_extensions=excluded.max_extensions,"
                                 + "max_lifetime_seconds=excluded.max_lifetime_seconds,"
                                 + "updated_by=excluded.updated_by,"
                                 + "updated_at_ms=excluded.updated_at_ms")) {
                ps.setString(1, namespace);
                ps.setString(2, entry.challengeId());
                ps.setLong(3, entry.baseRuntimeSeconds());
                ps.setLong(4, entry.extensionIncrementSeconds());
                ps.setInt(5, entry.maxExtensions());
                ps.setLong(6, entry.maxLifetimeSeconds());
                ps.setString(7, entry.updatedBy());
                ps.setLong(8, entry.updatedAtMs());
                ps.executeUpdate();
                return null;
            }
        });
    }

    public boolean remove(String challengeId) {
        return database.withRetry("policy.remove", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "DELETE FROM runtime_policies WHERE namespace=? AND challenge_id=?")) {
                ps.setString(1, namespace);
                ps.setString(2, challengeId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public Optional<PolicyEntry> find(String challengeId) {
        return database.withRetry("policy.find", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT " + COLUMNS + " FROM runtime_policies WHERE namespace=? AND challenge_id=?")) {
                ps.setString(1, namespace);
                ps.setString(2, challengeId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<PolicyEntry> list() {
        return database.withRetry("policy.list", () -> {
            List<PolicyEntry> out = new ArrayList<>();
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT " + COLUMNS + " FROM runtime_policies WHERE namespace=? ORDER BY challenge_id")) {
                ps.setString(1, namespace);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(map(rs));
                    }
                }
            }
            return out;
        });
    }

    private static PolicyEntry map(ResultSet rs) throws SQLException {
        return new PolicyEntry(
                rs.getString("challenge_id"),
                rs.getLong("base_runtime_seconds"),
                rs.getLong("extension_increment_seconds"),
                rs.getInt("max_extensions"),
                rs.getLong("max_lifetime_seconds"),
                rs.getString("updated_by"),
                rs.getLong("updated_at_ms")
        );
    }
}
