package org.nostree.nostr.client;

import org.nostree.nostr.protocol.Event;

/**
 * Receives the frames a session routes to one long-lived subscription.
 * Invoked from the OkHttp reader thread, never while the session lock is held.
 */
interface SessionSubscriber {

    void onEvent(String relayUrl, Event event);

    void onEndOfStoredEvents(String relayUrl);

    /** Relay sent CLOSED, or the socket dropped. */
    void onClosed(String relayUrl, String reason);
}
