package org.nostree.nostr.outbox;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.nostree.nostr.EventFixtures;
import org.nostree.nostr.FakeRelay;
import org.nostree.nostr.client.RelayConnectionPool;
import org.nostree.nostr.protocol.Event;
import org.nostree.nostr.protocol.EventKinds;
import org.nostree.nostr.protocol.Filter;
import org.nostree.nostr.storage.InMemoryRoutingStorage;
import org.nostree.nostr.storage.RelayRoute;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.nostree.nostr.EventFixtures.relayList;
import static org.nostree.nostr.EventFixtures.tag;

public class OutboxRouterTest {

    private static final String ALICE = EventFixtures.pubkey(1);
    private static final String BOB = EventFixtures.pubkey(2);
    private static final String CAROL = EventFixtures.pubkey(3);
    private static final List<String> FALLBACK = Arrays.asList("wss://fallback.example.com", "wss://second.example.com");

    private RelayConnectionPool pool;
    private FakeRelay relay;
    private InMemoryRoutingStorage storage;
    private OutboxRouter router;

    @Before
    public void setUp() throws Exception {
        pool = new RelayConnectionPool();
        pool.setQueryTimeoutMs(3000);
        relay = new FakeRelay();
        storage = new InMemoryRoutingStorage();
        router = new OutboxRouter(pool, storage, FALLBACK);
    }

    @After
    public void tearDown() throws Exception {
        pool.close();
        relay.close();
    }

    @Test
    public void testNewestRelayListWins() throws Exception {
        long now = EventFixtures.now();
        relay.store(
                relayList(ALICE, now - 100, tag("r", "wss://old.example.com")),
                relayList(ALICE, now - 10, tag("r", "wss://new.example.com", "write")),
                relayList(BOB, now - 50, tag("r", "wss://bob.example.com")));

        DiscoveryResult result = router.discoverOutboxEvents(Arrays.asList(ALICE, BOB, CAROL),
                Collections.singletonList(relay.url())).get(10, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals(3, result.getEventsFound());
        assertEquals(2, result.getUsersDiscovered());
        assertEquals(Collections.singletonList(new RelayRoute(ALICE, "wss://new.example.com", false, true, now - 10)),
                storage.getRoutes(ALICE));
        assertEquals(Collections.singletonList("wss://bob.example.com"), storage.getWriteRelays(BOB));
        assertTrue(storage.getRoutes(CAROL).isEmpty());
    }

    @Test
    public void testRediscoveryIsIdempotent() throws Exception {
        long now = EventFixtures.now();
        relay.store(relayList(ALICE, now - 10,
                tag("r", "wss://one.example.com"), tag("r", "wss://two.example.com", "read")));

        router.discoverOutboxEvents(Collections.singletonList(ALICE), Collections.singletonList(relay.url()))
                .get(10, TimeUnit.SECONDS);
        List<RelayRoute> first = storage.getRoutes(ALICE);
        router.discoverOutboxEvents(Collections.singletonList(ALICE), Collections.singletonList(relay.url()))
                .get(10, TimeUnit.SECONDS);

        assertEquals(first, storage.getRoutes(ALICE));
        assertEquals(2, router.getStats().getTotalRoutes());
    }

    @Test
    public void testStoredNewerRoutesAreKept() {
        storage.upsertRoutes(ALICE, Collections.singletonList(
                new RelayRoute(ALICE, "wss://current.example.com", true, true, 2000)));

        boolean stored = router.processRelayList(relayList(ALICE, 1000, tag("r", "wss://stale.example.com")));

        assertFalse(stored);
        assertEquals(Collections.singletonList("wss://current.example.com"), storage.getWriteRelays(ALICE));
        assertTrue(router.processRelayList(relayList(ALICE, 3000, tag("r", "wss://fresh.example.com"))));
        assertEquals(Collections.singletonList("wss://fresh.example.com"), storage.getWriteRelays(ALICE));
    }

    @Test
    public void testBatchesCoverEveryUser() throws Exception {
        router.setBatchSize(2);
        long now = EventFixtures.now();
        List<String> users = EventFixtures.pubkeys(5);
        for (String user : users) {
            relay.store(relayList(user, now - 5, tag("r", "wss://" + user.substring(60) + ".example.com")));
        }

        DiscoveryResult result = router.discoverOutboxEvents(users, Collections.singletonList(relay.url()))
                .get(10, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals(5, result.getUsersDiscovered());
        assertEquals(5, storage.getAllUsers().size());
        assertEquals(3, relay.getReqIds().size());
    }

    @Test
    public void testUnreachableRelaysYieldEmptySuccess() throws Exception {
        relay.silent();
        pool.setQueryTimeoutMs(300);

        DiscoveryResult result = router.discoverOutboxEvents(Collections.singletonList(ALICE),
                Collections.singletonList(relay.url())).get(10, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals(0, result.getUsersDiscovered());
    }

    @Test
    public void testInvalidInputFails() throws Exception {
        assertFalse(router.discoverOutboxEvents(Collections.<String>emptyList(),
                Collections.singletonList(relay.url())).get(1, TimeUnit.SECONDS).isSuccess());
        assertFalse(router.discoverOutboxEvents(Collections.singletonList(ALICE),
                Collections.singletonList("https://not-a-relay")).get(1, TimeUnit.SECONDS).isSuccess());

        router.setEnabled(false);
        DiscoveryResult disabled = router.discoverOutboxEvents(Collections.singletonList(ALICE),
                Collections.singletonList(relay.url())).get(1, TimeUnit.SECONDS);
        assertFalse(disabled.isSuccess());
        assertNotNull(disabled.getError());
    }

    @Test
    public void testDiscoveryFilter() {
        router.setClock(Clock.fixed(Instant.ofEpochSecond(100_000_000L), ZoneOffset.UTC));

        Filter small = router.discoveryFilter(Arrays.asList(ALICE, BOB));
        Filter large = router.discoveryFilter(EventFixtures.pubkeys(150));

        assertEquals(Collections.singletonList(EventKinds.RELAY_LIST), small.getKinds());
        assertEquals(Arrays.asList(ALICE, BOB), small.getAuthors());
        assertEquals(Integer.valueOf(4), small.getLimit());
        assertEquals(Long.valueOf(100_000_000L - OutboxRouter.DISCOVERY_LOOKBACK_SECONDS), small.getSince());
        assertEquals(Integer.valueOf(OutboxRouter.MAX_QUERY_LIMIT), large.getLimit());
    }

    @Test
    public void testRouteQuerySplitsAuthorsByWriteRelay() {
        storage.upsertRoutes(ALICE, Arrays.asList(
                new RelayRoute(ALICE, "wss://shared.example.com", false, true, 1),
                new RelayRoute(ALICE, "wss://alice-inbox.example.com", true, false, 1)));
        storage.upsertRoutes(BOB, Arrays.asList(
                new RelayRoute(BOB, "wss://shared.example.com", true, true, 1),
                new RelayRoute(BOB, "wss://bob.example.com", false, true, 1)));

        Filter filter = Filter.builder().kinds(1).authors(ALICE, BOB, CAROL).limit(20).build();
        Map<String, Filter> routes = router.routeQuery(filter);

        assertEquals(new HashSet<>(Arrays.asList("wss://shared.example.com", "wss://bob.example.com",
                "wss://fallback.example.com")), routes.keySet());
        assertEquals(Arrays.asList(ALICE, BOB), routes.get("wss://shared.example.com").getAuthors());
        assertEquals(Collections.singletonList(BOB), routes.get("wss://bob.example.com").getAuthors());
        assertEquals(Collections.singletonList(CAROL), routes.get("wss://fallback.example.com").getAuthors());
        assertEquals(Integer.valueOf(20), routes.get("wss://bob.example.com").getLimit());
        assertEquals(Collections.singletonList(1), routes.get("wss://bob.example.com").getKinds());
    }

    @Test
    public void testRouteQueryWithoutAuthorsUsesFallback() {
        Filter filter = Filter.builder().kinds(1).build();

        Map<String, Filter> routes = router.routeQuery(filter);

        assertEquals(Collections.singletonMap("wss://fallback.example.com", filter), routes);
    }

    @Test
    public void testMaxRelaysPerUser() {
        storage.upsertRoutes(ALICE, Arrays.asList(
                new RelayRoute(ALICE, "wss://a.example.com", false, true, 1),
                new RelayRoute(ALICE, "wss://b.example.com", false, true, 1),
                new RelayRoute(ALICE, "wss://c.example.com", false, true, 1)));
        router.setMaxRelaysPerUser(2);

        Event event = EventFixtures.note(ALICE, 1000, "hi");

        assertEquals(Arrays.asList("wss://a.example.com", "wss://b.example.com"), router.routeEvent(event));
    }

    @Test
    public void testRouteEventFallsBackWithoutWriteRelays() {
        storage.upsertRoutes(ALICE, Collections.singletonList(
                new RelayRoute(ALICE, "wss://inbox.example.com", true, false, 1)));

        assertEquals(FALLBACK, router.routeEvent(EventFixtures.note(ALICE, 1000, "hi")));
        assertEquals(FALLBACK, router.routeEvent(EventFixtures.note(BOB, 1000, "hi")));

        router.setEnabled(false);
        storage.upsertRoutes(BOB, Collections.singletonList(
                new RelayRoute(BOB, "wss://bob.example.com", false, true, 1)));
        assertEquals(FALLBACK, router.routeEvent(EventFixtures.note(BOB, 1000, "hi")));
    }
}
