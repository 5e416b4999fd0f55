package org.nostree.nostr.client;

/**
 * Base class for failures scoped to a single relay.
 * The pool catches these per relay; multi-relay calls never fail because of one.
 */
public class RelayException extends RuntimeException {

    private final String relayUrl;

    public RelayException(String relayUrl, String message) {
        super(message);
        this.relayUrl = relayUrl;
    }

    public RelayException(String relayUrl, String message, Throwable cause) {
        super(message, cause);
        this.relayUrl = relayUrl;
    }

    /**
     * Relay the failure belongs to, or null for pool-wide failures.
     */
    public String getRelayUrl() {
        return relayUrl;
    }
}
