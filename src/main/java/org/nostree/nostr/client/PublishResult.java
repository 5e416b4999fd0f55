package org.nostree.nostr.client;

/**
 * Outcome of publishing one event to one relay.
 */
public class PublishResult {

    private final String relayUrl;
    private final boolean success;
    private final String message;

    public PublishResult(String relayUrl, boolean success, String message) {
        this.relayUrl = relayUrl;
        this.success = success;
        this.message = message != null ? message : "";
    }

    public static PublishResult accepted(String relayUrl, String message) {
        return new PublishResult(relayUrl, true, message);
    }

    public static PublishResult failed(String relayUrl, String message) {
        return new PublishResult(relayUrl, false, message);
    }

    public String getRelayUrl() { return relayUrl; }
    public boolean isSuccess() { return success; }

    /** Relay's OK message on success, failure reason otherwise. */
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "PublishResult{" + relayUrl + ", " + (success ? "ok" : "failed") +
                (message.isEmpty() ? "" : ", '" + message + "'") + '}';
    }
}
