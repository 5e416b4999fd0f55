package org.nostree.nostr.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * NIP-01 wire codec.
 * Encodes client frames ({@code REQ}, {@code CLOSE}, {@code EVENT}) and decodes relay
 * frames ({@code EVENT}, {@code EOSE}, {@code OK}, {@code NOTICE}, {@code CLOSED}).
 */
public final class RelayMessages {

    private static final ObjectMapper JSON = new ObjectMapper();

    /**
     * Encode {@code ["REQ", subscriptionId, filter...]}.
     */
    public static String req(String subscriptionId, List<Filter> filters) {
        List<Object> reqMessage = new ArrayList<>();
        reqMessage.add("REQ");
        reqMessage.add(subscriptionId);
        reqMessage.addAll(filters);
        return write(reqMessage);
    }

    /**
     * Encode {@code ["CLOSE", subscriptionId]}.
     */
    public static String close(String subscriptionId) {
        return write(Arrays.asList("CLOSE", subscriptionId));
    }

    /**
     * Encode {@code ["EVENT", event]}.
     */
    public static String event(Event event) {
        return write(Arrays.asList("EVENT", event));
    }

    /**
     * Decode a relay frame.
     *
     * @param text Raw WebSocket text frame
     * @return Decoded message, {@link RelayMessage.Type#UNKNOWN} for unrecognised labels
     * @throws MalformedMessageException if the frame is not a well-formed relay message
     */
    public static RelayMessage parse(String text) {
        JsonNode json;
        try {
            json = JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Relay frame is not JSON", e);
        }
        if (json == null || !json.isArray() || json.size() == 0 || !json.get(0).isTextual()) {
            throw new MalformedMessageException("Relay frame is not a labelled array");
        }

        String label = json.get(0).asText();
        switch (label) {
            case "EVENT":
                requireSize(json, 3, label);
                try {
                    Event event = JSON.treeToValue(json.get(2), Event.class);
                    return RelayMessage.event(json.get(1).asText(), event);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    throw new MalformedMessageException("EVENT payload is not an event", e);
                }
            case "EOSE":
                requireSize(json, 2, label);
                return RelayMessage.endOfStoredEvents(json.get(1).asText());
            case "OK":
                requireSize(json, 3, label);
                String statusMessage = json.size() > 3 ? json.get(3).asText("") : "";
                return RelayMessage.ok(json.get(1).asText(), json.get(2).asBoolean(false), statusMessage);
            case "NOTICE":
                return RelayMessage.notice(json.size() > 1 ? json.get(1).asText("") : "");
            case "CLOSED":
                requireSize(json, 2, label);
                String reason = json.size() > 2 ? json.get(2).asText("") : "";
                return RelayMessage.closed(json.get(1).asText(), reason);
            default:
                return RelayMessage.unknown(label);
        }
    }

    private static void requireSize(JsonNode json, int size, String label) {
        if (json.size() < size) {
            throw new MalformedMessageException(label + " frame needs " + size + " elements, got " + json.size());
        }
    }

    private static String write(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode client frame", e);
        }
    }

    private RelayMessages() {
        // Utility class, no instantiation
    }
}
