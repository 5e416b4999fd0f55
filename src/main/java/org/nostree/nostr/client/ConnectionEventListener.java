package org.nostree.nostr.client;

/**
 * Connection event listener for monitoring relay sessions.
 */
public interface ConnectionEventListener {
    /** Called when a relay connection is established. */
    default void onConnect(String relayUrl) {}
    /** Called when a relay connection is lost. */
    default void onDisconnect(String relayUrl, String reason) {}
    /** Called when reconnection is being attempted. */
    default void onReconnecting(String relayUrl, int attempt) {}
    /** Called when reconnection succeeds. */
    default void onReconnected(String relayUrl) {}
    /** Called when a session exhausted its retry budget and stops taking work. */
    default void onDegraded(String relayUrl, int attempts) {}
}
