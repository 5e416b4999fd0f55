package org.nostree.nostr.outbox;

import org.nostree.nostr.client.RelayUrls;
import org.nostree.nostr.protocol.Event;
import org.nostree.nostr.protocol.EventKinds;
import org.nostree.nostr.storage.RelayRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns NIP-65 relay-list events (kind 10002) into {@link RelayRoute}s.
 *
 * <p>Relay tags are {@code ["r", url, marker?]}; {@code "relay"} is accepted as an
 * alias. No marker, or an unknown one, means read+write; {@code read} and
 * {@code write} restrict the route. Tags without a usable URL are skipped, and
 * repeated URLs have their flags combined.
 */
public final class RelayListParser {

    private static final Logger logger = LoggerFactory.getLogger(RelayListParser.class);

    public static final String RELAY_TAG = "r";
    public static final String RELAY_TAG_ALIAS = "relay";
    public static final String MARKER_READ = "read";
    public static final String MARKER_WRITE = "write";

    /**
     * Parse a relay-list event.
     *
     * @param event Kind 10002 event
     * @return Routes of the event's author, stamped with the event's {@code created_at}
     * @throws MalformedDocumentException if the event is not a relay list or has no author
     */
    public static List<RelayRoute> parse(Event event) {
        if (event == null) {
            throw new MalformedDocumentException(null, "Relay list is null");
        }
        if (event.getKind() != EventKinds.RELAY_LIST) {
            throw new MalformedDocumentException(event.getId(),
                    "Expected kind " + EventKinds.RELAY_LIST + " but got " + event.getKind());
        }
        String author = event.getPubkey();
        if (author == null || author.isEmpty()) {
            throw new MalformedDocumentException(event.getId(), "Relay list has no author");
        }

        Map<String, RelayRoute> byRelay = new LinkedHashMap<>();
        for (List<String> tag : event.getTags()) {
            if (tag == null || tag.size() < 2) {
                continue;
            }
            String name = tag.get(0);
            if (!RELAY_TAG.equals(name) && !RELAY_TAG_ALIAS.equals(name)) {
                continue;
            }
            Optional<String> url = RelayUrls.tryNormalize(tag.get(1));
            if (!url.isPresent()) {
                logger.debug("Skipping invalid relay URL '{}' in relay list {}", tag.get(1), event.getId());
                continue;
            }
            String marker = tag.size() > 2 && tag.get(2) != null ? tag.get(2).trim().toLowerCase(Locale.ROOT) : "";
            boolean canRead = !MARKER_WRITE.equals(marker);
            boolean canWrite = !MARKER_READ.equals(marker);

            RelayRoute route = new RelayRoute(author, url.get(), canRead, canWrite, event.getCreatedAt());
            byRelay.merge(url.get(), route, RelayRoute::merge);
        }
        return new ArrayList<>(byRelay.values());
    }

    private RelayListParser() {
        // Utility class
    }
}
