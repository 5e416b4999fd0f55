package org.nostree.nostr.client;

/**
 * A frame was sent on a session whose socket is not open.
 */
public class NotConnectedException extends RelayException {

    public NotConnectedException(String relayUrl) {
        super(relayUrl, "Not connected to relay: " + relayUrl);
    }
}
