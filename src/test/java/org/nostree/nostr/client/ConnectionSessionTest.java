package org.nostree.nostr.client;

import okhttp3.mockwebserver.MockWebServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.nostree.nostr.EventFixtures;
import org.nostree.nostr.FakeRelay;
import org.nostree.nostr.Waiting;
import org.nostree.nostr.protocol.Event;
import org.nostree.nostr.protocol.Filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * Tests for session lifecycle: backoff, degradation and reconnection.
 */
public class ConnectionSessionTest {

    private RelayConnectionPool pool;
    private FakeRelay relay;

    @Before
    public void setUp() throws Exception {
        pool = new RelayConnectionPool();
        pool.setReconnectIntervalMs(50);
        pool.setMaxReconnectIntervalMs(200);
        relay = new FakeRelay();
    }

    @After
    public void tearDown() throws Exception {
        pool.close();
        relay.close();
    }

    @Test
    public void testExponentialBackoffCalculation() {
        // base * 2^(attempt-1), capped
        assertEquals(1000, ConnectionSession.backoffDelay(1000, 30000, 1));
        assertEquals(2000, ConnectionSession.backoffDelay(1000, 30000, 2));
        assertEquals(4000, ConnectionSession.backoffDelay(1000, 30000, 3));
        assertEquals(8000, ConnectionSession.backoffDelay(1000, 30000, 4));
        assertEquals(16000, ConnectionSession.backoffDelay(1000, 30000, 5));
        assertEquals(30000, ConnectionSession.backoffDelay(1000, 30000, 6));  // 32000, capped
        assertEquals(30000, ConnectionSession.backoffDelay(1000, 30000, 40)); // Always capped
    }

    @Test
    public void testExponentialBackoffWithCustomConfig() {
        assertEquals(500, ConnectionSession.backoffDelay(500, 10000, 1));
        assertEquals(1000, ConnectionSession.backoffDelay(500, 10000, 2));
        assertEquals(8000, ConnectionSession.backoffDelay(500, 10000, 5));
        assertEquals(10000, ConnectionSession.backoffDelay(500, 10000, 6));
    }

    @Test
    public void testOpenIsIdempotent() throws Exception {
        ConnectionSession session = pool.getConnection(relay.url());

        session.open().get(5, TimeUnit.SECONDS);
        session.open().get(5, TimeUnit.SECONDS);

        assertTrue(session.isConnected());
        assertSame(session, pool.getConnection(relay.url()));
        assertEquals(1, relay.getConnectionCount());
    }

    @Test
    public void testSendWhenNotConnectedThrows() {
        ConnectionSession session = new ConnectionSession(relay.url(), pool);

        try {
            session.send("sub", "[\"CLOSE\",\"sub\"]");
            fail("Expected NotConnectedException");
        } catch (NotConnectedException e) {
            assertEquals(relay.url(), e.getRelayUrl());
        }
    }

    @Test
    public void testUnreachableRelayDegradesAfterRetryBudget() throws Exception {
        String deadUrl = unusedLocalUrl();
        pool.setMaxReconnectAttempts(2);

        List<Integer> reconnecting = new CopyOnWriteArrayList<>();
        CountDownLatch degraded = new CountDownLatch(1);
        AtomicInteger degradedAfter = new AtomicInteger();
        pool.addConnectionListener(new ConnectionEventListener() {
            @Override
            public void onReconnecting(String relayUrl, int attempt) {
                reconnecting.add(attempt);
            }

            @Override
            public void onDegraded(String relayUrl, int failedAttempts) {
                degradedAfter.set(failedAttempts);
                degraded.countDown();
            }
        });

        ConnectionSession session = pool.getConnection(deadUrl);
        try {
            session.open().get(5, TimeUnit.SECONDS);
            fail("Expected connection failure");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof RelayConnectException);
        }

        assertTrue("session should degrade", degraded.await(5, TimeUnit.SECONDS));
        assertEquals(2, degradedAfter.get());
        assertEquals(Arrays.asList(1, 2), new ArrayList<>(reconnecting));
        assertTrue(session.isDegraded());
        assertTrue(pool.getConnectionStatus(deadUrl).isDegraded());

        try {
            pool.getConnection(deadUrl);
            fail("Degraded relay must be refused");
        } catch (RelayConnectException expected) {
            // expected
        }

        assertTrue(pool.retry(deadUrl));
        assertFalse(pool.retry(deadUrl));
        ConnectionSession fresh = pool.getConnection(deadUrl);
        assertNotSame(session, fresh);
        assertFalse(fresh.isDegraded());
    }

    @Test
    public void testSubscriptionIsRestoredAfterReconnect() throws Exception {
        Event live = EventFixtures.note(EventFixtures.pubkey(1), EventFixtures.now(), "after restart");
        CountDownLatch reconnected = new CountDownLatch(1);
        List<String> disconnects = new CopyOnWriteArrayList<>();
        pool.addConnectionListener(new ConnectionEventListener() {
            @Override
            public void onDisconnect(String relayUrl, String reason) {
                disconnects.add(reason);
            }

            @Override
            public void onReconnected(String relayUrl) {
                reconnected.countDown();
            }
        });

        List<Event> received = new CopyOnWriteArrayList<>();
        CountDownLatch eose = new CountDownLatch(1);
        SubscriptionHandle handle = pool.subscribeMany(Collections.singletonList(relay.url()),
                Filter.builder().kinds(1).build(), new NostrEventListener() {
                    @Override
                    public void onEvent(String relayUrl, Event event) {
                        received.add(event);
                    }

                    @Override
                    public void onEndOfStoredEvents(String subscriptionId) {
                        eose.countDown();
                    }
                });
        assertTrue(eose.await(5, TimeUnit.SECONDS));

        relay.dropConnections();

        assertTrue("session should reconnect", reconnected.await(5, TimeUnit.SECONDS));
        assertEquals(1, disconnects.size());
        Waiting.until("REQ to be re-sent", 5000, () -> relay.getReqIds().size() == 2);
        assertEquals(handle.getId(), relay.getReqIds().get(1));

        relay.broadcast(live);
        Waiting.until("live event", 5000, () -> received.contains(live));
        handle.close();
    }

    @Test
    public void testClosedSessionDoesNotReconnect() throws Exception {
        ConnectionSession session = pool.getConnection(relay.url());
        session.open().get(5, TimeUnit.SECONDS);

        pool.close(Collections.singletonList(relay.url()));

        assertEquals(SocketState.CLOSED, session.getState());
        Thread.sleep(300);
        assertEquals(1, relay.getConnectionCount());
        assertNull(pool.getConnectionStatus(relay.url()));
    }

    private static String unusedLocalUrl() throws Exception {
        MockWebServer server = new MockWebServer();
        server.start();
        int port = server.getPort();
        server.shutdown();
        return "ws://127.0.0.1:" + port;
    }
}
