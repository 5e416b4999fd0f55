package org.nostree.nostr.client;

/**
 * Lifecycle of the WebSocket behind a {@link ConnectionSession}.
 */
public enum SocketState {
    CONNECTING,
    OPEN,
    CLOSED;

    /** Whether the socket counts against the pool's connection ceiling. */
    public boolean isActive() {
        return this == CONNECTING || this == OPEN;
    }
}
