package org.nostree.nostr.client;

import org.nostree.nostr.protocol.Event;

/**
 * Listener interface for receiving events from a streaming subscription.
 */
public interface NostrEventListener {

    /**
     * Called for every event a relay delivers for the subscription.
     * Events seen on several relays are delivered once per relay.
     *
     * @param relayUrl Relay the event arrived from
     * @param event The received event
     */
    void onEvent(String relayUrl, Event event);

    /**
     * Called once every relay of the subscription has sent EOSE or failed.
     *
     * @param subscriptionId The subscription ID
     */
    default void onEndOfStoredEvents(String subscriptionId) {
        // Optional callback
    }

    /**
     * Called when a relay closes the subscription or cannot be reached.
     * The subscription stays open on the remaining relays.
     *
     * @param relayUrl Relay that failed
     * @param error Error message
     */
    default void onError(String relayUrl, String error) {
        // Optional callback
    }
}
