package io.agentrelay.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * SQLite-backed {@link ResultStore}. Expiry is enforced on read; expired rows linger until
 * {@link #purgeExpired()} runs.
 */
public final class SqliteResultStore implements ResultStore {
    private final Database db;
    private final Clock clock;

    public SqliteResultStore(Database db) {
        this(db, Clock.systemUTC());
    }

    public SqliteResultStore(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public String put(String taskId, String payload, Duration ttl) {
        String key = ResultStore.storageKey(taskId);
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        long now = clock.millis();
        String sql = """
                INSERT INTO result_payloads(storage_key, task_id, payload, created_at_ms, expires_at_ms)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(storage_key) DO UPDATE SET
                    payload = excluded.payload,
                    created_at_ms = excluded.created_at_ms,
                    expires_at_ms = excluded.expires_at_ms
                """;
        try (Connection conn = db.openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, taskId);
            ps.setString(3, payload);
            ps.setLong(4, now);
            ps.setLong(5, now + ttl.toMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store result payload: " + key, e);
        }
        return key;
    }

    @Override
    public Optional<String> get(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String sql = "SELECT payload FROM result_payloads WHERE storage_key=? AND expires_at_ms>?";
        try (Connection conn = db.openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, reference);
            ps.setLong(2, clock.millis());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getString("payload"));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read result payload: " + reference, e);
        }
    }

    @Override
    public boolean delete(String reference) {
        if (reference == null || reference.isBlank()) {
            return false;
        }
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM result_payloads WHERE storage_key=?")) {
            ps.setString(1, reference);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete result payload: " + reference, e);
        }
    }

    @Override
    public int purgeExpired() {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM result_payloads WHERE expires_at_ms<=?")) {
            ps.setLong(1, clock.millis());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge expired result payloads", e);
        }
    }
}
