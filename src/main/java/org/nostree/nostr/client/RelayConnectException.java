package org.nostree.nostr.client;

/**
 * The WebSocket to a relay could not be opened, or the session is degraded.
 */
public class RelayConnectException extends RelayException {

    public RelayConnectException(String relayUrl, String message) {
        super(relayUrl, message);
    }

    public RelayConnectException(String relayUrl, String message, Throwable cause) {
        super(relayUrl, message, cause);
    }
}
