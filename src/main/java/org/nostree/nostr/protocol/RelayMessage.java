package org.nostree.nostr.protocol;

/**
 * A decoded relay-to-client frame.
 * Only the fields relevant to {@link #getType()} are populated.
 */
public class RelayMessage {

    /**
     * Relay frame types understood by the client.
     */
    public enum Type {
        EVENT,
        EOSE,
        OK,
        NOTICE,
        CLOSED,
        UNKNOWN
    }

    private final Type type;
    private final String subscriptionId;
    private final Event event;
    private final String eventId;
    private final boolean accepted;
    private final String message;

    private RelayMessage(Type type, String subscriptionId, Event event,
                         String eventId, boolean accepted, String message) {
        this.type = type;
        this.subscriptionId = subscriptionId;
        this.event = event;
        this.eventId = eventId;
        this.accepted = accepted;
        this.message = message;
    }

    public static RelayMessage event(String subscriptionId, Event event) {
        return new RelayMessage(Type.EVENT, subscriptionId, event, null, false, null);
    }

    public static RelayMessage endOfStoredEvents(String subscriptionId) {
        return new RelayMessage(Type.EOSE, subscriptionId, null, null, false, null);
    }

    public static RelayMessage ok(String eventId, boolean accepted, String message) {
        return new RelayMessage(Type.OK, null, null, eventId, accepted, message);
    }

    public static RelayMessage notice(String message) {
        return new RelayMessage(Type.NOTICE, null, null, null, false, message);
    }

    public static RelayMessage closed(String subscriptionId, String message) {
        return new RelayMessage(Type.CLOSED, subscriptionId, null, null, false, message);
    }

    public static RelayMessage unknown(String label) {
        return new RelayMessage(Type.UNKNOWN, null, null, null, false, label);
    }

    public Type getType() { return type; }
    public String getSubscriptionId() { return subscriptionId; }
    public Event getEvent() { return event; }
    public String getEventId() { return eventId; }
    public boolean isAccepted() { return accepted; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "RelayMessage{" +
                "type=" + type +
                (subscriptionId != null ? ", subscriptionId='" + subscriptionId + "'" : "") +
                (eventId != null ? ", eventId='" + eventId + "'" : "") +
                (message != null ? ", message='" + message + "'" : "") +
                '}';
    }
}
