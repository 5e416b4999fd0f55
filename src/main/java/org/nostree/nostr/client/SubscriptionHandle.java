package org.nostree.nostr.client;

import java.util.Set;

/**
 * Handle to a long-lived subscription spanning several relays.
 */
public interface SubscriptionHandle extends AutoCloseable {

    /** Subscription ID sent to every relay. */
    String getId();

    /** Relays the subscription is currently registered on. */
    Set<String> getRelays();

    boolean isClosed();

    /**
     * Unsubscribe from every relay. Safe to call more than once and from any thread;
     * other subscriptions on the same sessions are not affected.
     */
    @Override
    void close();
}
