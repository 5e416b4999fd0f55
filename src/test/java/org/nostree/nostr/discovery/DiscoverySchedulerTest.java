package org.nostree.nostr.discovery;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.nostree.nostr.EventFixtures;
import org.nostree.nostr.Waiting;
import org.nostree.nostr.outbox.DiscoveryResult;
import org.nostree.nostr.outbox.OutboxRouter;
import org.nostree.nostr.storage.InMemoryRoutingStorage;
import org.nostree.nostr.storage.InMemorySettingsStore;
import org.nostree.nostr.storage.RelayRoute;
import org.nostree.nostr.storage.RoutingStorage;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class DiscoverySchedulerTest {

    private static final long START = 1_700_000_000_000L;

    private MutableClock clock;
    private InMemoryRoutingStorage storage;
    private InMemorySettingsStore settings;
    private StubRouter router;
    private DiscoveryScheduler scheduler;

    @Before
    public void setUp() {
        clock = new MutableClock(START);
        storage = new InMemoryRoutingStorage();
        settings = new InMemorySettingsStore();
        router = new StubRouter(storage);
        scheduler = newScheduler(25);
    }

    @After
    public void tearDown() {
        scheduler.close();
    }

    private DiscoveryScheduler newScheduler(int batchSize) {
        return new DiscoveryScheduler(router, settings, DiscoveryConfig.builder()
                .bootstrapRelays("wss://bootstrap.example.com")
                .batchSize(batchSize)
                .batchDelayMs(0)
                .clock(clock)
                .build());
    }

    @Test
    public void testProgressAdvancesPerBatch() throws Exception {
        List<Integer> percentages = new CopyOnWriteArrayList<>();
        scheduler.addListener(new DiscoveryListener() {
            @Override
            public void onProgress(DiscoverySession session, DiscoveryProgress progress) {
                percentages.add(progress.getPercentage());
            }
        });

        DiscoveryOutcome outcome = scheduler.discoverForUsers(EventFixtures.pubkeys(100)).get(5, TimeUnit.SECONDS);

        assertEquals(DiscoveryOutcome.Status.COMPLETED, outcome.getStatus());
        assertEquals(100, outcome.getUsersRequested());
        assertEquals(Arrays.asList(25, 50, 75, 100), percentages);
        assertEquals(4, router.batches.size());
        assertEquals(100, scheduler.activity().getDiscoveredUsers());
        assertTrue(scheduler.discoveryProgress().isComplete());
        assertTrue(scheduler.hasCompletedInitialDiscovery());
        assertFalse(scheduler.isDiscovering());
    }

    @Test
    public void testTriggerWhileRunningIsSkipped() throws Exception {
        router.block();
        CompletableFuture<DiscoveryOutcome> first = scheduler.discoverForUsers(EventFixtures.pubkeys(3));
        assertTrue(router.entered.await(5, TimeUnit.SECONDS));

        assertTrue(scheduler.isDiscovering());
        assertTrue(scheduler.activity().isActive());
        assertEquals(Collections.singletonList("wss://bootstrap.example.com"), scheduler.activity().getActiveRelays());
        assertTrue(scheduler.currentSession().isPresent());
        DiscoveryOutcome second = scheduler.discoverForUsers(EventFixtures.pubkeys(3)).get(1, TimeUnit.SECONDS);
        assertEquals(DiscoveryOutcome.Status.SKIPPED, second.getStatus());
        assertEquals("Discovery already running", second.getReason());

        router.release.countDown();
        assertEquals(DiscoveryOutcome.Status.COMPLETED, first.get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(1, router.batches.size());
        assertFalse(scheduler.currentSession().isPresent());
    }

    @Test
    public void testCheckAndDiscoverRespectsIntervals() throws Exception {
        List<String> users = EventFixtures.pubkeys(3);

        DiscoveryOutcome firstLoad = scheduler.checkAndDiscover(users).get(5, TimeUnit.SECONDS);
        assertEquals(DiscoveryOutcome.Status.COMPLETED, firstLoad.getStatus());
        assertTrue(firstLoad.getTriggers().contains(DiscoveryTrigger.FIRST_LOAD));
        assertTrue(firstLoad.getTriggers().contains(DiscoveryTrigger.EMPTY_TABLE));
        assertEquals(START, scheduler.getLastDiscoveryAt());

        clock.advance(TimeUnit.MINUTES.toMillis(5));
        DiscoveryOutcome tooSoon = scheduler.checkAndDiscover(users).get(5, TimeUnit.SECONDS);
        assertEquals(DiscoveryOutcome.Status.SKIPPED, tooSoon.getStatus());
        assertEquals("Too soon since last run", tooSoon.getReason());

        clock.advance(TimeUnit.MINUTES.toMillis(30));
        List<String> withNewcomer = new ArrayList<>(users);
        withNewcomer.add(EventFixtures.pubkey(99));
        DiscoveryOutcome incremental = scheduler.checkAndDiscover(withNewcomer).get(5, TimeUnit.SECONDS);
        assertEquals(Collections.singleton(DiscoveryTrigger.MIN_INTERVAL_ELAPSED), incremental.getTriggers());
        assertEquals(1, incremental.getUsersRequested());
        assertEquals(Collections.singletonList(EventFixtures.pubkey(99)), router.lastBatch());

        clock.advance(TimeUnit.HOURS.toMillis(3));
        DiscoveryOutcome refresh = scheduler.checkAndDiscover(withNewcomer).get(5, TimeUnit.SECONDS);
        assertTrue(refresh.getTriggers().contains(DiscoveryTrigger.REFRESH_DUE));
        assertEquals(4, refresh.getUsersRequested());
    }

    @Test
    public void testEmptyRoutingTableForcesRun() throws Exception {
        List<String> users = EventFixtures.pubkeys(2);
        scheduler.checkAndDiscover(users).get(5, TimeUnit.SECONDS);
        storage.clear();

        DiscoveryOutcome outcome = scheduler.checkAndDiscover(users).get(5, TimeUnit.SECONDS);

        assertEquals(Collections.singleton(DiscoveryTrigger.EMPTY_TABLE), outcome.getTriggers());
        assertEquals(DiscoveryOutcome.Status.COMPLETED, outcome.getStatus());
        assertEquals(2, outcome.getUsersRequested());
        assertEquals(2, storage.getAllUsers().size());
    }

    @Test
    public void testAlreadyDiscoveredUsersAreSkipped() throws Exception {
        scheduler.discoverForUsers(EventFixtures.pubkeys(2)).get(5, TimeUnit.SECONDS);

        DiscoveryOutcome again = scheduler.discoverForUsers(EventFixtures.pubkeys(2)).get(5, TimeUnit.SECONDS);

        assertEquals(DiscoveryOutcome.Status.SKIPPED, again.getStatus());
        assertEquals(1, router.batches.size());
    }

    @Test
    public void testFailedBatchIsRetriedNextTime() throws Exception {
        router.failNext = true;
        DiscoveryOutcome failed = scheduler.discoverForUsers(EventFixtures.pubkeys(2)).get(5, TimeUnit.SECONDS);
        assertEquals(DiscoveryOutcome.Status.COMPLETED, failed.getStatus());
        assertFalse(failed.getResult().isSuccess());
        assertEquals(0, scheduler.activity().getDiscoveredUsers());

        DiscoveryOutcome retried = scheduler.discoverForUsers(EventFixtures.pubkeys(2)).get(5, TimeUnit.SECONDS);

        assertTrue(retried.getResult().isSuccess());
        assertEquals(2, router.batches.size());
    }

    @Test
    public void testCancelStopsAfterCurrentBatch() throws Exception {
        scheduler.close();
        scheduler = newScheduler(10);
        scheduler.addListener(new DiscoveryListener() {
            @Override
            public void onProgress(DiscoverySession session, DiscoveryProgress progress) {
                scheduler.cancel();
            }
        });

        DiscoveryOutcome outcome = scheduler.discoverForUsers(EventFixtures.pubkeys(50)).get(5, TimeUnit.SECONDS);

        assertEquals(DiscoveryOutcome.Status.CANCELLED, outcome.getStatus());
        assertEquals(1, router.batches.size());
        assertEquals(20, scheduler.discoveryProgress().getPercentage());
        assertEquals(0L, scheduler.getLastDiscoveryAt());
        assertNull(settings.get(DiscoveryState.LAST_DISCOVERY_KEY));
        assertFalse(scheduler.cancel());
    }

    @Test
    public void testLastDiscoveryTimeIsPersisted() throws Exception {
        scheduler.discoverForUsers(EventFixtures.pubkeys(1)).get(5, TimeUnit.SECONDS);

        assertEquals(START, settings.getLong(DiscoveryState.LAST_DISCOVERY_KEY, 0L));
        DiscoveryScheduler restarted = newScheduler(25);
        try {
            assertEquals(START, restarted.getLastDiscoveryAt());
        } finally {
            restarted.close();
        }
    }

    @Test
    public void testLastDiscoveryTimeFallsBackToRoutes() {
        storage.upsertRoutes(EventFixtures.pubkey(1), Collections.singletonList(
                new RelayRoute(EventFixtures.pubkey(1), "wss://a.example.com", true, true, 500)));

        DiscoveryScheduler fresh = newScheduler(25);
        try {
            assertEquals(500_000L, fresh.getLastDiscoveryAt());
        } finally {
            fresh.close();
        }
    }

    @Test
    public void testWithoutBootstrapRelaysDiscoveryIsSkipped() throws Exception {
        DiscoveryScheduler noRelays = new DiscoveryScheduler(router, settings,
                DiscoveryConfig.builder().clock(clock).build());
        try {
            DiscoveryOutcome outcome = noRelays.discoverForUsers(EventFixtures.pubkeys(1)).get(5, TimeUnit.SECONDS);

            assertEquals(DiscoveryOutcome.Status.SKIPPED, outcome.getStatus());
            assertTrue(noRelays.hasCompletedInitialDiscovery());
            assertTrue(router.batches.isEmpty());
        } finally {
            noRelays.close();
        }
    }

    @Test
    public void testCheckWithoutUsersIsSkipped() throws Exception {
        DiscoveryOutcome outcome = scheduler.checkAndDiscover(Collections.<String>emptyList()).get(1, TimeUnit.SECONDS);

        assertTrue(outcome.isSkipped());
        assertTrue(router.batches.isEmpty());
    }

    @Test
    public void testClosedSchedulerSkips() throws Exception {
        scheduler.close();

        DiscoveryOutcome outcome = scheduler.discoverForUsers(EventFixtures.pubkeys(1)).get(1, TimeUnit.SECONDS);

        assertEquals(DiscoveryOutcome.Status.SKIPPED, outcome.getStatus());
        assertFalse(scheduler.isDiscovering());
    }

    @Test
    public void testProgressPercentageCapsBeforeCompletion() {
        assertEquals(99, DiscoveryProgress.of(199, 200).getPercentage());
        assertEquals(99, DiscoveryProgress.of(99, 100).getPercentage());
        assertEquals(100, DiscoveryProgress.of(200, 200).getPercentage());
        assertEquals(100, DiscoveryProgress.of(0, 0).getPercentage());
        assertEquals(0, DiscoveryProgress.of(0, 7).getPercentage());
        assertFalse(DiscoveryProgress.of(6, 7).isComplete());
    }

    @Test
    public void testPeriodicRefreshRequeriesDiscoveredUsers() throws Exception {
        List<String> users = EventFixtures.pubkeys(3);
        DiscoveryScheduler periodic = new DiscoveryScheduler(router, settings, DiscoveryConfig.builder()
                .bootstrapRelays("wss://bootstrap.example.com")
                .batchDelayMs(0)
                .refreshIntervalMs(50)
                .clock(clock)
                .build());
        try {
            periodic.discoverForUsers(users).get(5, TimeUnit.SECONDS);
            assertEquals(1, router.batches.size());
            assertEquals(DiscoveryOutcome.Status.SKIPPED,
                    periodic.discoverForUsers(users).get(5, TimeUnit.SECONDS).getStatus());

            periodic.start(() -> users);

            Waiting.until("periodic refresh", 5000, () -> router.batches.size() >= 2);
            periodic.stop();
            assertEquals(users, router.batches.get(1));
        } finally {
            periodic.close();
        }
    }

    @Test
    public void testRestartWithRecentDiscoverySkipsFirstCheck() throws Exception {
        List<String> users = EventFixtures.pubkeys(3);
        for (String user : users) {
            storage.upsertRoutes(user, Collections.singletonList(
                    new RelayRoute(user, "wss://known.example.com", true, true, START / 1000 - 60)));
        }
        settings.setLong(DiscoveryState.LAST_DISCOVERY_KEY, START - TimeUnit.SECONDS.toMillis(60));
        DiscoveryScheduler restarted = newScheduler(25);
        try {
            DiscoveryOutcome outcome = restarted.checkAndDiscover(users).get(5, TimeUnit.SECONDS);

            assertEquals(DiscoveryOutcome.Status.SKIPPED, outcome.getStatus());
            assertTrue(outcome.getTriggers().isEmpty());
            assertTrue(router.batches.isEmpty());
        } finally {
            restarted.close();
        }
    }

    @Test
    public void testFirstLoadFiresOnceAcrossConcurrentChecks() throws Exception {
        router.block();
        List<String> users = EventFixtures.pubkeys(2);
        int callers = 8;
        CountDownLatch go = new CountDownLatch(1);
        List<CompletableFuture<DiscoveryOutcome>> outcomes = new CopyOnWriteArrayList<>();
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            Thread thread = new Thread(() -> {
                try {
                    go.await();
                    outcomes.add(scheduler.checkAndDiscover(users));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            thread.start();
            threads.add(thread);
        }
        go.countDown();
        for (Thread thread : threads) {
            thread.join(5000);
        }
        router.release.countDown();

        int firstLoads = 0;
        for (CompletableFuture<DiscoveryOutcome> outcome : outcomes) {
            if (outcome.get(5, TimeUnit.SECONDS).getTriggers().contains(DiscoveryTrigger.FIRST_LOAD)) {
                firstLoads++;
            }
        }
        assertEquals(callers, outcomes.size());
        assertEquals(1, firstLoads);
    }

    /**
     * Router that stores one route per requested user instead of querying relays.
     */
    private static class StubRouter extends OutboxRouter {
        final List<List<String>> batches = new CopyOnWriteArrayList<>();
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean blocking = false;
        volatile boolean failNext = false;

        StubRouter(RoutingStorage storage) {
            super(null, storage, Collections.singletonList("wss://fallback.example.com"));
        }

        void block() {
            blocking = true;
        }

        List<String> lastBatch() {
            return batches.get(batches.size() - 1);
        }

        @Override
        public CompletableFuture<DiscoveryResult> discoverBatch(List<String> batch, List<String> relays) {
            batches.add(new ArrayList<>(batch));
            entered.countDown();
            if (blocking) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failNext) {
                failNext = false;
                return CompletableFuture.completedFuture(DiscoveryResult.failure("relay unavailable"));
            }
            for (String user : batch) {
                getStorage().upsertRoutes(user, Collections.singletonList(
                        new RelayRoute(user, "wss://" + user.substring(56) + ".example.com", true, true, 1)));
            }
            return CompletableFuture.completedFuture(DiscoveryResult.success(batch.size(), batch.size()));
        }
    }

    private static class MutableClock extends Clock {
        private volatile long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long deltaMs) {
            millis += deltaMs;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
