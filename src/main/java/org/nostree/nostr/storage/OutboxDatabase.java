package org.nostree.nostr.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * SQLite database file holding the routing table and client settings.
 * Call {@link #init()} once before handing it to the stores.
 */
public final class OutboxDatabase {

    private static final Logger logger = LoggerFactory.getLogger(OutboxDatabase.class);

    private final Path dbFile;
    private final String jdbcUrl;

    public OutboxDatabase(Path dbFile) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
    }

    public Path getDbFile() {
        return dbFile;
    }

    /**
     * Create the parent directory and the schema if they do not exist yet.
     */
    public void init() {
        initDirectories();
        initSchema();
        applyPragmas();
        logger.info("Outbox database ready: {}", dbFile);
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        // Per connection; concurrent writers wait instead of failing with SQLITE_BUSY
        props.setProperty("busy_timeout", "5000");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        Path parent = dbFile.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory " + parent, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS relay_routes ("
                    + " user_id TEXT NOT NULL,"
                    + " relay_url TEXT NOT NULL,"
                    + " can_read INTEGER NOT NULL,"
                    + " can_write INTEGER NOT NULL,"
                    + " discovered_at INTEGER NOT NULL,"
                    + " updated_at_ms INTEGER NOT NULL,"
                    + " PRIMARY KEY(user_id, relay_url)"
                    + ")");
            st.execute("CREATE INDEX IF NOT EXISTS idx_relay_routes_relay ON relay_routes(relay_url)");
            st.execute("CREATE TABLE IF NOT EXISTS settings ("
                    + " key TEXT PRIMARY KEY,"
                    + " value TEXT NOT NULL,"
                    + " updated_at_ms INTEGER NOT NULL"
                    + ")");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize schema", e);
        }
    }

    private void applyPragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
        } catch (SQLException e) {
            throw new StorageException("Failed to apply SQLite pragmas", e);
        }
    }
}
