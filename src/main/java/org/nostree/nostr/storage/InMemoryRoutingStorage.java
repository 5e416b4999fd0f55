package org.nostree.nostr.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Non-persistent {@link RoutingStorage}, for tests and ephemeral clients.
 */
public class InMemoryRoutingStorage implements RoutingStorage {

    private final Map<String, List<RelayRoute>> routesByUser = new TreeMap<>();

    @Override
    public synchronized Set<String> getAllUsers() {
        return new LinkedHashSet<>(routesByUser.keySet());
    }

    @Override
    public synchronized void upsertRoutes(String userId, Collection<RelayRoute> routes) {
        Map<String, RelayRoute> byRelay = new LinkedHashMap<>();
        for (RelayRoute route : routes) {
            if (!route.getUserId().equals(userId)) {
                throw new IllegalArgumentException("Route " + route + " does not belong to " + userId);
            }
            byRelay.put(route.getRelayUrl(), route);
        }
        if (byRelay.isEmpty()) {
            routesByUser.remove(userId);
            return;
        }
        List<RelayRoute> sorted = new ArrayList<>(byRelay.values());
        sorted.sort(Comparator.comparing(RelayRoute::getRelayUrl));
        routesByUser.put(userId, sorted);
    }

    @Override
    public synchronized List<RelayRoute> getRoutes(String userId) {
        List<RelayRoute> routes = routesByUser.get(userId);
        return routes != null ? new ArrayList<>(routes) : new ArrayList<>();
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
    public synchronized Map<String, List<RelayRoute>> getRoutesForUsers(Collection<String> userIds) {
        Map<String, List<RelayRoute>> result = new LinkedHashMap<>();
        for (String userId : new TreeSet<>(userIds)) {
            List<RelayRoute> routes = routesByUser.get(userId);
            if (routes != null) {
                result.put(userId, new ArrayList<>(routes));
            }
        }
        return result;
    }

    @Override
    public Set<String> getUsersWithRoutes(Collection<String> userIds) {
        return new LinkedHashSet<>(getRoutesForUsers(userIds).keySet());
    }

    @Override
    public synchronized long getLatestDiscoveredAt() {
        long latest = 0;
        for (List<RelayRoute> routes : routesByUser.values()) {
            for (RelayRoute route : routes) {
                latest = Math.max(latest, route.getDiscoveredAt());
            }
        }
        return latest;
    }

    @Override
    public synchronized RoutingStats getStats() {
        Set<String> relays = new HashSet<>();
        int total = 0;
        for (List<RelayRoute> routes : routesByUser.values()) {
            for (RelayRoute route : routes) {
                relays.add(route.getRelayUrl());
                total++;
            }
        }
        return new RoutingStats(routesByUser.size(), relays.size(), total);
    }

    @Override
    public synchronized void clear() {
        routesByUser.clear();
    }
}
