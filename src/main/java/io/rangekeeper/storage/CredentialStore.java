package io.rangekeeper.storage;

import io.rangekeeper.error.RangeKeeperException;
import io.rangekeeper.model.CredentialRecord;
import io.rangekeeper.model.ErrorKind;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class CredentialStore {
    private final Database database;

    public CredentialStore(Database database) {
        this.database = database;
    }

    public void insert(CredentialRecord record) {
        database.withRetry("credential.insert", () -> {
            try (Connection c = database.openConnection()) {
                insert(c, record);
                return null;
            }
        });
    }

    void insert(Connection c, CredentialRecord record) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO credentials(instance_id,ciphertext,key_id,created_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, record.instanceId());
            ps.setString(2, record.ciphertext());
            ps.setInt(3, record.keyId());
            ps.setLong(4, record.createdAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (Database.isConstraintViolation(e) && exists(c, record.instanceId())) {
                throw new RangeKeeperException(
                        ErrorKind.DUPLICATE_BINDING,
                        "Credential already bound to instance " + record.instanceId(),
                        e
                );
            }
            throw e;
        }
    }

    public boolean delete(String instanceId) {
        return database.withRetry("credential.delete", () -> {
            try (Connection c = database.openConnection()) {
                return delete(c, instanceId);
            }
        });
    }

    boolean delete(Connection c, String instanceId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM credentials WHERE instance_id=?")) {
            ps.setString(1, instanceId);
            return ps.executeUpdate() > 0;
        }
    }

    public Optional<CredentialRecord> find(String instanceId) {
        return database.withRetry("credential.find", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT instance_id,ciphertext,key_id,created_at_ms FROM credentials WHERE instance_id=?")) {
                ps.setString(1, instanceId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new CredentialRecord(
                            rs.getString("instance_id"),
                            rs.getString("ciphertext"),
                            rs.getInt("key_id"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
        });
    }

    public Map<Integer, Integer> countByKey() {
        return database.withRetry("credential.countByKey", () -> {
            Map<Integer, Integer> out = new LinkedHashMap<>();
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT key_id, COUNT(*) AS n FROM credentials GROUP BY key_id ORDER BY key_id");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getInt("key_id"), rs.getInt("n"));
                }
            }
            return out;
        });
    }

    private boolean exists(Connection c, String instanceId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM credentials WHERE instance_id=?")) {
            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
