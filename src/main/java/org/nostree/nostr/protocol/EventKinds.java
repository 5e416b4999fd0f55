package org.nostree.nostr.protocol;

/**
 * Nostr event kinds used by the relay pool and the outbox router.
 * See: https://github.com/nostr-protocol/nips
 */
public final class EventKinds {

    /** NIP-01: Text note */
    public static final int TEXT_NOTE = 1;

    /** NIP-65: Relay list metadata (the relay-preference document) */
    public static final int RELAY_LIST = 10002;

    private EventKinds() {
        // Utility class, no instantiation
    }
}
