package org.nostree.nostr.client;

/**
 * Point-in-time view of one pooled session, for diagnostics and relay status displays.
 */
public class RelayConnectionStatus {

    private final String url;
    private final SocketState state;
    private final boolean degraded;
    private final int reconnectAttempts;
    private final String lastError;
    private final long lastActivity;
    private final int inFlightRequests;

    public RelayConnectionStatus(String url, SocketState state, boolean degraded, int reconnectAttempts,
                                 String lastError, long lastActivity, int inFlightRequests) {
        this.url = url;
        this.state = state;
        this.degraded = degraded;
        this.reconnectAttempts = reconnectAttempts;
        this.lastError = lastError;
        this.lastActivity = lastActivity;
        this.inFlightRequests = inFlightRequests;
    }

    public String getUrl() { return url; }
    public SocketState getState() { return state; }
    public boolean isConnected() { return state == SocketState.OPEN; }
    public boolean isDegraded() { return degraded; }
    public int getReconnectAttempts() { return reconnectAttempts; }
    public String getLastError() { return lastError; }

    /** Epoch millis of the last frame sent or received. */
    public long getLastActivity() { return lastActivity; }

    /** Open queries, subscriptions and unacknowledged publishes. */
    public int getInFlightRequests() { return inFlightRequests; }

    @Override
    public String toString() {
        return "RelayConnectionStatus{" + url +
                ", state=" + state +
                (degraded ? ", degraded" : "") +
                ", attempts=" + reconnectAttempts +
                ", inFlight=" + inFlightRequests +
                (lastError != null ? ", lastError='" + lastError + "'" : "") +
                '}';
    }
}
