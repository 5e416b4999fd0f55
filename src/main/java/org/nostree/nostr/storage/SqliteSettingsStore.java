package org.nostree.nostr.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * {@link SettingsStore} backed by the {@code settings} table of an {@link OutboxDatabase}.
 */
public final class SqliteSettingsStore implements SettingsStore {

    private final OutboxDatabase database;

    public SqliteSettingsStore(OutboxDatabase database) {
        this.database = database;
    }

    @Override
    public String get(String key) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT value FROM settings WHERE key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read setting " + key, e);
        }
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            remove(key);
            return;
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO settings(key,value,updated_at_ms) VALUES(?,?,?) "
                             + "ON CONFLICT(key) DO UPDATE SET value=excluded.value, updated_at_ms=excluded.updated_at_ms")) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to write setting " + key, e);
        }
    }

    @Override
    public void remove(String key) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM settings WHERE key=?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to remove setting " + key, e);
        }
    }
}
