package org.nostree.nostr;

import org.nostree.nostr.protocol.Event;
import org.nostree.nostr.protocol.EventIds;
import org.nostree.nostr.protocol.EventKinds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Events with valid IDs for tests. Signatures are placeholders; nothing here verifies them.
 */
public final class EventFixtures {

    public static final String PLACEHOLDER_SIG = repeat('0', 128);

    /**
     * Deterministic 32-byte hex public key.
     */
    public static String pubkey(int n) {
        return String.format("%064x", n);
    }

    public static List<String> pubkeys(int count) {
        List<String> keys = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            keys.add(pubkey(i));
        }
        return keys;
    }

    public static Event note(String pubkey, long createdAt, String content) {
        Event event = new Event();
        event.setPubkey(pubkey);
        event.setCreatedAt(createdAt);
        event.setKind(EventKinds.TEXT_NOTE);
        event.setContent(content);
        event.setSig(PLACEHOLDER_SIG);
        return EventIds.assignId(event);
    }

    /**
     * Relay list with one tag per {@code relayTags} entry, e.g. {@code tag("r", "wss://a.com", "read")}.
     */
    @SafeVarargs
    public static Event relayList(String pubkey, long createdAt, List<String>... relayTags) {
        Event event = new Event();
        event.setPubkey(pubkey);
        event.setCreatedAt(createdAt);
        event.setKind(EventKinds.RELAY_LIST);
        List<List<String>> tags = new ArrayList<>();
        for (List<String> tag : relayTags) {
            tags.add(new ArrayList<>(tag));
        }
        event.setTags(tags);
        event.setSig(PLACEHOLDER_SIG);
        return EventIds.assignId(event);
    }

    public static List<String> tag(String... values) {
        return Arrays.asList(values);
    }

    public static long now() {
        return System.currentTimeMillis() / 1000;
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    private EventFixtures() {
    }
}
