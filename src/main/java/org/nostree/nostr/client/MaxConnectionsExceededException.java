package org.nostree.nostr.client;

/**
 * The pool stayed at its connection ceiling for the whole wait period.
 */
public class MaxConnectionsExceededException extends RelayException {

    private final int maxConnections;

    public MaxConnectionsExceededException(String relayUrl, int maxConnections, long waitedMs) {
        super(relayUrl, "Maximum connections (" + maxConnections + ") reached, waited "
                + waitedMs + "ms for " + relayUrl);
        this.maxConnections = maxConnections;
    }

    public int getMaxConnections() {
        return maxConnections;
    }
}
