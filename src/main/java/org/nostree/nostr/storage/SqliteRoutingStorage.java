package org.nostree.nostr.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link RoutingStorage} backed by the {@code relay_routes} table of an {@link OutboxDatabase}.
 */
public final class SqliteRoutingStorage implements RoutingStorage {

    private static final Logger logger = LoggerFactory.getLogger(SqliteRoutingStorage.class);

    // SQLite's default host parameter limit is 999
    private static final int MAX_IN_PARAMS = 500;

    private static final String SELECT_ROUTE =
            "SELECT user_id, relay_url, can_read, can_write, discovered_at FROM relay_routes";

    private final OutboxDatabase database;

    public SqliteRoutingStorage(OutboxDatabase database) {
        this.database = database;
    }

    @Override
    public Set<String> getAllUsers() {
        Set<String> users = new LinkedHashSet<>();
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT DISTINCT user_id FROM relay_routes ORDER BY user_id")) {
            while (rs.next()) {
                users.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list users", e);
        }
        return users;
    }

    @Override
    public void upsertRoutes(String userId, Collection<RelayRoute> routes) {
        for (RelayRoute route : routes) {
            if (!route.getUserId().equals(userId)) {
                throw new IllegalArgumentException("Route " + route + " does not belong to " + userId);
            }
        }
        long now = System.currentTimeMillis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement delete = c.prepareStatement("DELETE FROM relay_routes WHERE user_id=?");
                     PreparedStatement insert = c.prepareStatement(
                             "INSERT OR REPLACE INTO relay_routes(user_id,relay_url,can_read,can_write,discovered_at,updated_at_ms) VALUES(?,?,?,?,?,?)")) {
                    delete.setString(1, userId);
                    delete.executeUpdate();
                    for (RelayRoute route : routes) {
                        insert.setString(1, userId);
                        insert.setString(2, route.getRelayUrl());
                        insert.setInt(3, route.canRead() ? 1 : 0);
                        insert.setInt(4, route.canWrite() ? 1 : 0);
                        insert.setLong(5, route.getDiscoveredAt());
                        insert.setLong(6, now);
                        insert.addBatch();
                    }
                    insert.executeBatch();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to store routes of " + userId, e);
        }
        logger.debug("Stored {} routes for {}", routes.size(), userId);
    }

    @Override
    public List<RelayRoute> getRoutes(String userId) {
        List<RelayRoute> routes = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(SELECT_ROUTE + " WHERE user_id=? ORDER BY relay_url")) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    routes.add(readRoute(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read routes of " + userId, e);
        }
        return routes;
    }

    @Override
    public List<String> getReadRelays(String userId) {
        List<String> relays = new ArrayList<>();
        for (RelayRoute route : getRoutes(userId)) {
            if (route.canRead()) {
                relays.add(route.getRelayUrl());
            }
        }
        return relays;
    }

    @Override
    public List<String> getWriteRelays(String userId) {
        List<String> relays = new ArrayList<>();
        for (RelayRoute route : getRoutes(userId)) {
            if (route.canWrite()) {
                relays.add(route.getRelayUrl());
            }
        }
        return relays;
    }

    @Override
    public Map<String, List<RelayRoute>> getRoutesForUsers(Collection<String> userIds) {
        Map<String, List<RelayRoute>> result = new LinkedHashMap<>();
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(userIds));
        try (Connection c = database.openConnection()) {
            for (int start = 0; start < ids.size(); start += MAX_IN_PARAMS) {
                List<String> chunk = ids.subList(start, Math.min(ids.size(), start + MAX_IN_PARAMS));
                String sql = SELECT_ROUTE + " WHERE user_id IN (" + placeholders(chunk.size()) + ") ORDER BY user_id, relay_url";
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    for (int i = 0; i < chunk.size(); i++) {
                        ps.setString(i + 1, chunk.get(i));
                    }
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            RelayRoute route = readRoute(rs);
                            result.computeIfAbsent(route.getUserId(), k -> new ArrayList<>()).add(route);
                        }
                    }
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read routes of " + ids.size() + " users", e);
        }
        return result;
    }

    @Override
    public Set<String> getUsersWithRoutes(Collection<String> userIds) {
        return new LinkedHashSet<>(getRoutesForUsers(userIds).keySet());
    }

    @Override
    public long getLatestDiscoveredAt() {
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(discovered_at), 0) FROM relay_routes")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StorageException("Failed to read latest discovery time", e);
        }
    }

    @Override
    public RoutingStats getStats() {
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT COUNT(DISTINCT user_id), COUNT(DISTINCT relay_url), COUNT(*) FROM relay_routes")) {
            if (!rs.next()) {
                return new RoutingStats(0, 0, 0);
            }
            return new RoutingStats(rs.getInt(1), rs.getInt(2), rs.getInt(3));
        } catch (SQLException e) {
            throw new StorageException("Failed to read routing stats", e);
        }
    }

    @Override
    public void clear() {
        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
            int removed = st.executeUpdate("DELETE FROM relay_routes");
            logger.info("Cleared {} relay routes", removed);
        } catch (SQLException e) {
            throw new StorageException("Failed to clear routes", e);
        }
    }

    private static RelayRoute readRoute(ResultSet rs) throws SQLException {
        return new RelayRoute(
                rs.getString("user_id"),
                rs.getString("relay_url"),
                rs.getInt("can_read") != 0,
                rs.getInt("can_write") != 0,
                rs.getLong("discovered_at"));
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }
}
