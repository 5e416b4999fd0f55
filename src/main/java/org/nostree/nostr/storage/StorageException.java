package org.nostree.nostr.storage;

/**
 * Raised when the routing database cannot be read or written.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
