package org.nostree.nostr.client;

/**
 * A connect, query or publish deadline elapsed.
 */
public class RelayTimeoutException extends RelayException {

    private final long timeoutMs;

    public RelayTimeoutException(String relayUrl, String operation, long timeoutMs) {
        super(relayUrl, operation + " timed out after " + timeoutMs + "ms: " + relayUrl);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
