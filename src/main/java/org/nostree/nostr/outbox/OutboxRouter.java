package org.nostree.nostr.outbox;

import org.nostree.nostr.client.RelayConnectionPool;
import org.nostree.nostr.client.RelayUrls;
import org.nostree.nostr.protocol.Event;
import org.nostree.nostr.protocol.EventKinds;
import org.nostree.nostr.protocol.Filter;
import org.nostree.nostr.storage.RelayRoute;
import org.nostree.nostr.storage.RoutingStats;
import org.nostree.nostr.storage.RoutingStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Outbox (NIP-65) routing: discovers the relay lists of users, keeps the routing
 * table current, and answers "which relays should this query or event go to".
 *
 * <p>Only the newest relay list of an author is authoritative. Re-discovering an
 * unchanged list leaves the stored routes identical, and a stored route set that is
 * newer than a fetched list is never overwritten by it.
 */
public class OutboxRouter {

    private static final Logger logger = LoggerFactory.getLogger(OutboxRouter.class);

    public static final int DEFAULT_BATCH_SIZE = 25;
    public static final int DEFAULT_MAX_RELAYS_PER_USER = 3;
    public static final int MAX_QUERY_LIMIT = 200;
    public static final long DISCOVERY_LOOKBACK_SECONDS = TimeUnit.DAYS.toSeconds(90);
    public static final List<String> DEFAULT_FALLBACK_RELAYS = Collections.unmodifiableList(Arrays.asList(
            "wss://nos.lol",
            "wss://relay.snort.social",
            "wss://nostr.mom",
            "wss://purplepag.es"));

    private final RelayConnectionPool pool;
    private final RoutingStorage storage;
    private final List<String> fallbackRelays;

    private volatile int batchSize = DEFAULT_BATCH_SIZE;
    private volatile int maxRelaysPerUser = DEFAULT_MAX_RELAYS_PER_USER;
    private volatile boolean enabled = true;
    private volatile Clock clock = Clock.systemUTC();

    public OutboxRouter(RelayConnectionPool pool, RoutingStorage storage) {
        this(pool, storage, DEFAULT_FALLBACK_RELAYS);
    }

    /**
     * @param pool Pool used for discovery queries
     * @param storage Routing table
     * @param fallbackRelays Relays used for authors without routes
     */
    public OutboxRouter(RelayConnectionPool pool, RoutingStorage storage, List<String> fallbackRelays) {
        this.pool = pool;
        this.storage = storage;
        this.fallbackRelays = RelayUrls.normalizeAll(fallbackRelays);
    }

    // Configuration

    public void setBatchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
    }

    /**
     * Cap on the relays a single author contributes to {@link #routeQuery} and {@link #routeEvent}.
     */
    public void setMaxRelaysPerUser(int maxRelaysPerUser) { this.maxRelaysPerUser = maxRelaysPerUser; }

    /**
     * With the outbox model disabled, discovery is refused and every route is the fallback list.
     */
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public void setClock(Clock clock) { this.clock = clock; }

    public List<String> getFallbackRelays() {
        return Collections.unmodifiableList(fallbackRelays);
    }

    public RoutingStorage getStorage() {
        return storage;
    }

    // Discovery

    /**
     * Fetch the relay lists of {@code userIds} from {@code bootstrapRelays} and store their routes.
     * Users are queried in batches, one batch after another.
     *
     * @return Sum of the batch results; fails only for empty input, disabled routing or
     *         storage errors, never because of a relay
     */
    public CompletableFuture<DiscoveryResult> discoverOutboxEvents(Collection<String> userIds,
                                                                   Collection<String> bootstrapRelays) {
        if (!enabled) {
            return CompletableFuture.completedFuture(DiscoveryResult.failure("Outbox model disabled"));
        }
        if (userIds == null || userIds.isEmpty()) {
            return CompletableFuture.completedFuture(DiscoveryResult.failure("No users provided"));
        }
        List<String> relays = RelayUrls.normalizeAll(bootstrapRelays);
        if (relays.isEmpty()) {
            return CompletableFuture.completedFuture(DiscoveryResult.failure("No discovery relays provided"));
        }

        List<List<String>> batches = partition(new ArrayList<>(new LinkedHashSet<>(userIds)), batchSize);
        logger.info("Starting outbox discovery for {} users on {} relays ({} batches)",
                userIds.size(), relays.size(), batches.size());

        CompletableFuture<DiscoveryResult> chain = CompletableFuture.completedFuture(DiscoveryResult.success(0, 0));
        for (List<String> batch : batches) {
            chain = chain.thenCompose(total -> discoverBatch(batch, relays).thenApply(total::plus));
        }
        return chain.whenComplete((result, error) -> {
            if (result != null) {
                logger.info("Outbox discovery complete: {}", result);
            }
        });
    }

    /**
     * Discover one batch of users (at most {@link #MAX_QUERY_LIMIT} / 2 are useful per batch).
     */
    public CompletableFuture<DiscoveryResult> discoverBatch(List<String> batch, List<String> relays) {
        Filter filter = discoveryFilter(batch);
        return pool.querySync(relays, filter)
            .thenApply(events -> storeNewest(batch, events))
            .exceptionally(error -> {
                Throwable cause = error.getCause() != null ? error.getCause() : error;
                logger.error("Outbox discovery batch of {} users failed", batch.size(), cause);
                return DiscoveryResult.failure(cause.getMessage() != null
                        ? cause.getMessage() : cause.getClass().getSimpleName());
            });
    }

    /**
     * Filter for the relay lists of a batch of authors.
     */
    public Filter discoveryFilter(List<String> authors) {
        long since = clock.millis() / 1000 - DISCOVERY_LOOKBACK_SECONDS;
        int limit = Math.max(1, Math.min(2 * authors.size(), MAX_QUERY_LIMIT));
        return Filter.builder()
            .kinds(EventKinds.RELAY_LIST)
            .authors(authors)
            .since(since)
            .limit(limit)
            .build();
    }

    private DiscoveryResult storeNewest(List<String> batch, List<Event> events) {
        Set<String> requested = new HashSet<>(batch);
        Map<String, Event> newest = new LinkedHashMap<>();
        int found = 0;
        for (Event event : events) {
            if (event.getKind() != EventKinds.RELAY_LIST || !requested.contains(event.getPubkey())) {
                continue;
            }
            found++;
            Event current = newest.get(event.getPubkey());
            // Equal timestamps keep the first one seen
            if (current == null || event.getCreatedAt() > current.getCreatedAt()) {
                newest.put(event.getPubkey(), event);
            }
        }

        int discovered = 0;
        for (Event event : newest.values()) {
            try {
                processRelayList(event);
                discovered++;
            } catch (MalformedDocumentException e) {
                logger.warn("Skipping malformed relay list {}: {}", e.getEventId(), e.getMessage());
            }
        }
        logger.debug("Batch of {} users: {} relay lists, {} users routed", batch.size(), found, discovered);
        return DiscoveryResult.success(found, discovered);
    }

    /**
     * Store the routes of one relay list unless the stored routes are newer.
     *
     * @return false if the stored routes were newer and kept
     * @throws MalformedDocumentException if the event is not a relay list
     */
    public boolean processRelayList(Event event) {
        List<RelayRoute> routes = RelayListParser.parse(event);
        String author = event.getPubkey();

        long storedAt = 0;
        for (RelayRoute stored : storage.getRoutes(author)) {
            storedAt = Math.max(storedAt, stored.getDiscoveredAt());
        }
        if (storedAt > event.getCreatedAt()) {
            logger.debug("Keeping newer routes of {} ({} > {})", author, storedAt, event.getCreatedAt());
            return false;
        }
        if (routes.isEmpty()) {
            logger.debug("Relay list {} of {} has no usable relays", event.getId(), author);
        }
        storage.upsertRoutes(author, routes);
        return true;
    }

    // Routing

    /**
     * Split a query by author: each relay gets the filter narrowed to the authors
     * that publish there. Authors without routes are sent to the first fallback relay.
     *
     * @return Relay URL to filter; a filter without authors goes to the first fallback relay unchanged
     */
    public Map<String, Filter> routeQuery(Filter filter) {
        Map<String, Filter> routes = new LinkedHashMap<>();
        List<String> authors = filter.getAuthors();
        if (!enabled || authors == null || authors.isEmpty()) {
            if (!fallbackRelays.isEmpty()) {
                routes.put(fallbackRelays.get(0), filter);
            }
            return routes;
        }

        Map<String, List<RelayRoute>> known = storage.getRoutesForUsers(authors);
        Map<String, List<String>> authorsByRelay = new LinkedHashMap<>();
        List<String> unrouted = new ArrayList<>();
        for (String author : new LinkedHashSet<>(authors)) {
            List<String> relays = writeRelays(known.get(author));
            if (relays.isEmpty()) {
                unrouted.add(author);
                continue;
            }
            for (String relay : relays) {
                authorsByRelay.computeIfAbsent(relay, k -> new ArrayList<>()).add(author);
            }
        }
        if (!unrouted.isEmpty() && !fallbackRelays.isEmpty()) {
            List<String> fallbackAuthors = authorsByRelay.computeIfAbsent(fallbackRelays.get(0), k -> new ArrayList<>());
            fallbackAuthors.addAll(unrouted);
        }

        for (Map.Entry<String, List<String>> entry : authorsByRelay.entrySet()) {
            routes.put(entry.getKey(), filter.toBuilder().authors(entry.getValue()).build());
        }
        logger.debug("Routed query for {} authors to {} relays ({} without routes)",
                authors.size(), routes.size(), unrouted.size());
        return routes;
    }

    /**
     * Relays an event should be published to: its author's write relays, or the
     * fallback relays when the author has none.
     */
    public List<String> routeEvent(Event event) {
        if (!enabled || event.getPubkey() == null) {
            return new ArrayList<>(fallbackRelays);
        }
        List<String> relays = writeRelays(storage.getRoutes(event.getPubkey()));
        if (relays.isEmpty()) {
            logger.debug("No write relays for {}, using fallback", event.getPubkey());
            return new ArrayList<>(fallbackRelays);
        }
        return relays;
    }

    public RoutingStats getStats() {
        return storage.getStats();
    }

    private List<String> writeRelays(List<RelayRoute> routes) {
        List<String> relays = new ArrayList<>();
        if (routes == null) {
            return relays;
        }
        int cap = maxRelaysPerUser;
        for (RelayRoute route : routes) {
            if (route.canWrite() && relays.size() < cap) {
                relays.add(route.getRelayUrl());
            }
        }
        return relays;
    }

    static List<List<String>> partition(List<String> items, int size) {
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            batches.add(new ArrayList<>(items.subList(start, Math.min(items.size(), start + size))));
        }
        return batches;
    }
}
