package org.nostree.nostr.storage;

import java.util.Objects;

/**
 * One routing entry: a relay a user reads from and/or writes to.
 * At most one route exists per (user, relay); a route always has at least one flag.
 */
public final class RelayRoute {

    private final String userId;
    private final String relayUrl;
    private final boolean canRead;
    private final boolean canWrite;
    private final long discoveredAt;

    /**
     * @param userId Author public key (hex)
     * @param relayUrl Normalized relay URL
     * @param canRead The user reads (receives mentions) from this relay
     * @param canWrite The user publishes to this relay
     * @param discoveredAt {@code created_at} (seconds) of the relay list this route came from
     */
    public RelayRoute(String userId, String relayUrl, boolean canRead, boolean canWrite, long discoveredAt) {
        if (userId == null || userId.isEmpty()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (relayUrl == null || relayUrl.isEmpty()) {
            throw new IllegalArgumentException("relayUrl is required");
        }
        if (!canRead && !canWrite) {
            throw new IllegalArgumentException("Route to " + relayUrl + " must be readable or writable");
        }
        this.userId = userId;
        this.relayUrl = relayUrl;
        this.canRead = canRead;
        this.canWrite = canWrite;
        this.discoveredAt = discoveredAt;
    }

    // Getters
    public String getUserId() { return userId; }
    public String getRelayUrl() { return relayUrl; }
    public boolean canRead() { return canRead; }
    public boolean canWrite() { return canWrite; }
    public long getDiscoveredAt() { return discoveredAt; }

    /**
     * Combine the flags of two routes to the same relay.
     */
    public RelayRoute merge(RelayRoute other) {
        if (!relayUrl.equals(other.relayUrl) || !userId.equals(other.userId)) {
            throw new IllegalArgumentException("Cannot merge routes of different relays");
        }
        return new RelayRoute(userId, relayUrl, canRead || other.canRead, canWrite || other.canWrite,
                Math.max(discoveredAt, other.discoveredAt));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RelayRoute that = (RelayRoute) o;
        return canRead == that.canRead
                && canWrite == that.canWrite
                && discoveredAt == that.discoveredAt
                && userId.equals(that.userId)
                && relayUrl.equals(that.relayUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, relayUrl, canRead, canWrite, discoveredAt);
    }

    @Override
    public String toString() {
        String mode = canRead && canWrite ? "read+write" : canRead ? "read" : "write";
        return "RelayRoute{" + userId.substring(0, Math.min(16, userId.length())) + "... -> "
                + relayUrl + " (" + mode + ")}";
    }
}
