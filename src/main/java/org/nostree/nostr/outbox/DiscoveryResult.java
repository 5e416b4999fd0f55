package org.nostree.nostr.outbox;

/**
 * Outcome of {@link OutboxRouter#discoverOutboxEvents}.
 */
public final class DiscoveryResult {

    private final boolean success;
    private final int eventsFound;
    private final int usersDiscovered;
    private final String error;

    public DiscoveryResult(boolean success, int eventsFound, int usersDiscovered, String error) {
        this.success = success;
        this.eventsFound = eventsFound;
        this.usersDiscovered = usersDiscovered;
        this.error = error;
    }

    public static DiscoveryResult success(int eventsFound, int usersDiscovered) {
        return new DiscoveryResult(true, eventsFound, usersDiscovered, null);
    }

    public static DiscoveryResult failure(String error) {
        return new DiscoveryResult(false, 0, 0, error);
    }

    /**
     * Sum of two batch results. The sum succeeds only if both did; the first error wins.
     */
    public DiscoveryResult plus(DiscoveryResult other) {
        return new DiscoveryResult(
                success && other.success,
                eventsFound + other.eventsFound,
                usersDiscovered + other.usersDiscovered,
                error != null ? error : other.error);
    }

    // Getters
    public boolean isSuccess() { return success; }
    public int getEventsFound() { return eventsFound; }
    public int getUsersDiscovered() { return usersDiscovered; }

    /**
     * @return Error description, or null on success
     */
    public String getError() { return error; }

    @Override
    public String toString() {
        return "DiscoveryResult{success=" + success +
                ", eventsFound=" + eventsFound +
                ", usersDiscovered=" + usersDiscovered +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
