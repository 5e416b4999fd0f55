package org.nostree.nostr.discovery;

import java.util.Collections;
import java.util.List;

/**
 * Read-only view of the discovery state for other components, e.g. to avoid
 * competing with a running discovery for the same relays.
 */
public final class DiscoveryActivity {

    private final boolean active;
    private final List<String> activeRelays;
    private final long lastDiscoveryAt;
    private final int discoveredUsers;

    DiscoveryActivity(boolean active, List<String> activeRelays, long lastDiscoveryAt, int discoveredUsers) {
        this.active = active;
        this.activeRelays = Collections.unmodifiableList(activeRelays);
        this.lastDiscoveryAt = lastDiscoveryAt;
        this.discoveredUsers = discoveredUsers;
    }

    public boolean isActive() { return active; }
    public List<String> getActiveRelays() { return activeRelays; }

    /**
     * Epoch millis of the last completed run, 0 if none is known.
     */
    public long getLastDiscoveryAt() { return lastDiscoveryAt; }

    /**
     * Users discovered in the current refresh cycle.
     */
    public int getDiscoveredUsers() { return discoveredUsers; }

    @Override
    public String toString() {
        return "DiscoveryActivity{active=" + active + ", relays=" + activeRelays.size() +
                ", lastDiscoveryAt=" + lastDiscoveryAt + ", discoveredUsers=" + discoveredUsers + '}';
    }
}
