package org.nostree.nostr.storage;

/**
 * Size of the routing table.
 */
public class RoutingStats {

    private final int uniqueUsers;
    private final int uniqueRelays;
    private final int totalRoutes;

    public RoutingStats(int uniqueUsers, int uniqueRelays, int totalRoutes) {
        this.uniqueUsers = uniqueUsers;
        this.uniqueRelays = uniqueRelays;
        this.totalRoutes = totalRoutes;
    }

    public int getUniqueUsers() { return uniqueUsers; }
    public int getUniqueRelays() { return uniqueRelays; }
    public int getTotalRoutes() { return totalRoutes; }

    @Override
    public String toString() {
        return "RoutingStats{users=" + uniqueUsers + ", relays=" + uniqueRelays + ", routes=" + totalRoutes + '}';
    }
}
