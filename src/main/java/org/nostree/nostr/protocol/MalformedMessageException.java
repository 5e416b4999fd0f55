package org.nostree.nostr.protocol;

/**
 * Thrown when a relay frame is not a JSON array of a known shape.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
