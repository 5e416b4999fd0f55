package org.nostree.nostr.discovery;

/**
 * Observer of discovery runs. Callbacks run on the discovery thread.
 */
public interface DiscoveryListener {

    default void onDiscoveryStarted(DiscoverySession session) {}

    /**
     * Called after every batch.
     */
    default void onProgress(DiscoverySession session, DiscoveryProgress progress) {}

    default void onDiscoveryFinished(DiscoveryOutcome outcome) {}
}
