package org.nostree.nostr.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.binary.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;

/**
 * Event ID computation and verification (NIP-01).
 * The ID is the hex SHA-256 of {@code [0, pubkey, created_at, kind, tags, content]}.
 */
public final class EventIds {

    private static final ObjectMapper JSON = new ObjectMapper();

    /**
     * Calculate the canonical ID of an event.
     *
     * @param event Event with pubkey, created_at, kind, tags and content set
     * @return Lower-case hex SHA-256
     */
    public static String calculateId(Event event) {
        List<Object> eventData = Arrays.asList(
            0,
            event.getPubkey(),
            event.getCreatedAt(),
            event.getKind(),
            event.getTags(),
            event.getContent()
        );

        try {
            String eventJson = JSON.writeValueAsString(eventData);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(eventJson.getBytes(StandardCharsets.UTF_8));
            return new String(Hex.encodeHex(hashBytes));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event cannot be serialized: " + event, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Check that an event carries the ID its content hashes to.
     */
    public static boolean hasValidId(Event event) {
        if (event == null || event.getId() == null || event.getPubkey() == null) {
            return false;
        }
        return event.getId().equalsIgnoreCase(calculateId(event));
    }

    /**
     * Fill in the ID of an unsigned event and return it.
     */
    public static Event assignId(Event event) {
        event.setId(calculateId(event));
        return event;
    }

    private EventIds() {
        // Utility class, no instantiation
    }
}
