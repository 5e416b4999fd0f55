package org.nostree.nostr.outbox;

/**
 * A relay-list document that cannot be turned into routes (wrong kind, no author).
 */
public class MalformedDocumentException extends RuntimeException {

    private final String eventId;

    public MalformedDocumentException(String eventId, String message) {
        super(message);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
