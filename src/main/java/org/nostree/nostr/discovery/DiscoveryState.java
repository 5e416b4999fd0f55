package org.nostree.nostr.discovery;

import org.nostree.nostr.storage.RoutingStorage;
import org.nostree.nostr.storage.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by discovery runs. Written only by the scheduler thread, read by anyone
 * through {@link #snapshot()}.
 */
final class DiscoveryState {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryState.class);

    static final String LAST_DISCOVERY_KEY = "outbox.lastDiscoveryAt";

    private final SettingsStore settings;
    private final Set<String> discoveredUsers = ConcurrentHashMap.newKeySet();

    private volatile long lastDiscoveryAt;
    private final AtomicBoolean firstCheckPending = new AtomicBoolean(true);
    private volatile boolean initialDiscoveryComplete = false;
    private volatile boolean active = false;
    private volatile List<String> activeRelays = Collections.emptyList();
    private volatile DiscoverySession currentSession;

    DiscoveryState(SettingsStore settings, RoutingStorage storage) {
        this.settings = settings;
        this.lastDiscoveryAt = loadLastDiscoveryAt(settings, storage);
    }

    private static long loadLastDiscoveryAt(SettingsStore settings, RoutingStorage storage) {
        long stored = settings.getLong(LAST_DISCOVERY_KEY, 0L);
        if (stored > 0) {
            return stored;
        }
        try {
            // Routes carry relay-list timestamps in seconds
            return storage.getLatestDiscoveredAt() * 1000L;
        } catch (RuntimeException e) {
            logger.warn("Could not read latest route timestamp", e);
            return 0L;
        }
    }

    long getLastDiscoveryAt() {
        return lastDiscoveryAt;
    }

    void recordDiscovery(long now) {
        lastDiscoveryAt = now;
        try {
            settings.setLong(LAST_DISCOVERY_KEY, now);
        } catch (RuntimeException e) {
            logger.warn("Failed to persist last discovery time", e);
        }
    }

    /**
     * @return true exactly once, for the first check of a node that never ran discovery
     */
    boolean consumeFirstCheck() {
        if (lastDiscoveryAt != 0) {
            firstCheckPending.set(false);
            return false;
        }
        return firstCheckPending.getAndSet(false);
    }

    boolean isInitialDiscoveryComplete() {
        return initialDiscoveryComplete;
    }

    void markInitialDiscoveryComplete() {
        initialDiscoveryComplete = true;
    }

    List<String> filterUndiscovered(Collection<String> userIds) {
        List<String> pending = new ArrayList<>();
        for (String userId : new LinkedHashSet<>(userIds)) {
            if (userId != null && !userId.isEmpty() && !discoveredUsers.contains(userId)) {
                pending.add(userId);
            }
        }
        return pending;
    }

    void markDiscovered(Collection<String> userIds) {
        discoveredUsers.addAll(userIds);
    }

    void clearDiscovered() {
        discoveredUsers.clear();
    }

    void begin(DiscoverySession session, List<String> relays) {
        currentSession = session;
        activeRelays = Collections.unmodifiableList(new ArrayList<>(relays));
        active = true;
    }

    void end() {
        active = false;
        activeRelays = Collections.emptyList();
        currentSession = null;
    }

    DiscoverySession getCurrentSession() {
        return currentSession;
    }

    DiscoveryActivity snapshot() {
        return new DiscoveryActivity(active, activeRelays, lastDiscoveryAt, discoveredUsers.size());
    }
}
