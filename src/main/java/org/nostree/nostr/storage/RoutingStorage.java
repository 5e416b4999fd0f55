package org.nostree.nostr.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persistent user → relay routing table.
 *
 * <p>Routes of a user are only ever replaced as a whole by
 * {@link #upsertRoutes(String, Collection)}; readers never observe a partially
 * replaced set.
 */
public interface RoutingStorage {

    /**
     * All users that have at least one route.
     */
    Set<String> getAllUsers();

    /**
     * Replace the routes of a user in one transaction. An empty collection removes the user.
     *
     * @throws IllegalArgumentException if a route belongs to another user
     */
    void upsertRoutes(String userId, Collection<RelayRoute> routes);

    /**
     * Routes of a user, or an empty list when the user is unknown.
     */
    List<RelayRoute> getRoutes(String userId);

    /**
     * Relays the user reads from.
     */
    List<String> getReadRelays(String userId);

    /**
     * Relays the user publishes to.
     */
    List<String> getWriteRelays(String userId);

    /**
     * Routes of several users; users without routes are absent from the map.
     */
    Map<String, List<RelayRoute>> getRoutesForUsers(Collection<String> userIds);

    /**
     * The subset of {@code userIds} that have routes.
     */
    Set<String> getUsersWithRoutes(Collection<String> userIds);

    /**
     * Newest {@code discoveredAt} over all routes (seconds), or 0 when the table is empty.
     */
    long getLatestDiscoveredAt();

    RoutingStats getStats();

    /**
     * Remove every route.
     */
    void clear();
}
