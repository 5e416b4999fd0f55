package org.nostree.nostr;

import org.nostree.nostr.client.ConnectionEventListener;
import org.nostree.nostr.client.NostrEventListener;
import org.nostree.nostr.client.PublishResult;
import org.nostree.nostr.client.RelayConnectionPool;
import org.nostree.nostr.client.RelayConnectionStatus;
import org.nostree.nostr.client.SubscriptionHandle;
import org.nostree.nostr.discovery.DiscoveryActivity;
import org.nostree.nostr.discovery.DiscoveryListener;
import org.nostree.nostr.discovery.DiscoveryOutcome;
import org.nostree.nostr.discovery.DiscoveryProgress;
import org.nostree.nostr.discovery.DiscoveryScheduler;
import org.nostree.nostr.outbox.OutboxRouter;
import org.nostree.nostr.protocol.Event;
import org.nostree.nostr.protocol.Filter;
import org.nostree.nostr.storage.InMemoryRoutingStorage;
import org.nostree.nostr.storage.InMemorySettingsStore;
import org.nostree.nostr.storage.OutboxDatabase;
import org.nostree.nostr.storage.RelayRoute;
import org.nostree.nostr.storage.RoutingStats;
import org.nostree.nostr.storage.RoutingStorage;
import org.nostree.nostr.storage.SettingsStore;
import org.nostree.nostr.storage.SqliteRoutingStorage;
import org.nostree.nostr.storage.SqliteSettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point for applications: a relay pool, the outbox router over a routing table,
 * and background discovery, wired together from one {@link OutboxClientConfig}.
 *
 * <p>Network failures of individual relays never surface from this class; they show
 * up as missing events, failed {@link PublishResult}s or listener errors.
 */
public class OutboxClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OutboxClient.class);

    private final RelayConnectionPool pool;
    private final RoutingStorage storage;
    private final OutboxRouter router;
    private final DiscoveryScheduler scheduler;
    private volatile boolean closed = false;

    public OutboxClient(OutboxClientConfig config) {
        this(config, new RelayConnectionPool());
    }

    /**
     * Create a client on an existing pool, which this client then owns and closes.
     */
    public OutboxClient(OutboxClientConfig config, RelayConnectionPool pool) {
        this.pool = pool;
        pool.setMaxConnections(config.getMaxConnections());
        pool.setConnectTimeoutMs(config.getConnectTimeoutMs());
        pool.setConnectionWaitMs(config.getConnectionWaitMs());
        pool.setQueryTimeoutMs(config.getQueryTimeoutMs());
        pool.setPublishTimeoutMs(config.getPublishTimeoutMs());
        pool.setIdleTimeoutMs(config.getIdleTimeoutMs());
        pool.setMaxReconnectAttempts(config.getMaxReconnectAttempts());
        pool.setVerifyEventIds(config.isVerifyEventIds());

        SettingsStore settings;
        if (config.getDbPath() != null) {
            OutboxDatabase database = new OutboxDatabase(config.getDbPath());
            database.init();
            this.storage = new SqliteRoutingStorage(database);
            settings = new SqliteSettingsStore(database);
        } else {
            this.storage = new InMemoryRoutingStorage();
            settings = new InMemorySettingsStore();
        }

        this.router = new OutboxRouter(pool, storage, config.getFallbackRelays());
        router.setMaxRelaysPerUser(config.getMaxRelaysPerUser());
        router.setBatchSize(config.getDiscoveryBatchSize());
        this.scheduler = new DiscoveryScheduler(router, settings, config.toDiscoveryConfig());
        logger.info("Outbox client ready ({} bootstrap relays, routes in {})",
                config.getBootstrapRelays().size(),
                config.getDbPath() != null ? config.getDbPath() : "memory");
    }

    /**
     * Create a client from {@code nostree-outbox.properties} and system properties.
     */
    public static OutboxClient fromDefaultConfig() {
        return new OutboxClient(OutboxClientConfig.load());
    }

    // Discovery

    public CompletableFuture<DiscoveryOutcome> discoverForUsers(Collection<String> userIds) {
        return scheduler.discoverForUsers(userIds);
    }

    public CompletableFuture<DiscoveryOutcome> checkAndDiscover(Collection<String> userIds) {
        return scheduler.checkAndDiscover(userIds);
    }

    /**
     * Refresh the routes of {@code userSupplier}'s users periodically.
     */
    public void startPeriodicDiscovery(Supplier<? extends Collection<String>> userSupplier) {
        scheduler.start(userSupplier);
    }

    public boolean cancelDiscovery() {
        return scheduler.cancel();
    }

    public boolean isDiscovering() {
        return scheduler.isDiscovering();
    }

    public boolean hasCompletedInitialDiscovery() {
        return scheduler.hasCompletedInitialDiscovery();
    }

    public DiscoveryProgress discoveryProgress() {
        return scheduler.discoveryProgress();
    }

    public DiscoveryActivity discoveryActivity() {
        return scheduler.activity();
    }

    public void addDiscoveryListener(DiscoveryListener listener) {
        scheduler.addListener(listener);
    }

    public void removeDiscoveryListener(DiscoveryListener listener) {
        scheduler.removeListener(listener);
    }

    // Routing table

    public List<RelayRoute> getRoutes(String userId) {
        return storage.getRoutes(userId);
    }

    public RoutingStats getRoutingStats() {
        return router.getStats();
    }

    public void clearRoutes() {
        storage.clear();
    }

    public Map<String, Filter> routeQuery(Filter filter) {
        return router.routeQuery(filter);
    }

    public List<String> routeEvent(Event event) {
        return router.routeEvent(event);
    }

    // Relay traffic

    public CompletableFuture<List<Event>> querySync(Collection<String> relayUrls, Filter filter) {
        return pool.querySync(relayUrls, filter);
    }

    /**
     * Query the relays the filter's authors publish to, one narrowed filter per relay.
     *
     * @return Union of the events, de-duplicated by ID
     */
    public CompletableFuture<List<Event>> queryOutbox(Filter filter) {
        Map<String, Filter> routes = router.routeQuery(filter);
        List<CompletableFuture<List<Event>>> queries = new ArrayList<>();
        for (Map.Entry<String, Filter> route : routes.entrySet()) {
            queries.add(pool.querySync(Collections.singletonList(route.getKey()), route.getValue()));
        }
        return CompletableFuture.allOf(queries.toArray(new CompletableFuture[0])).thenApply(v -> {
            Map<String, Event> events = new LinkedHashMap<>();
            for (CompletableFuture<List<Event>> query : queries) {
                for (Event event : query.join()) {
                    events.putIfAbsent(event.getId(), event);
                }
            }
            return new ArrayList<>(events.values());
        });
    }

    public CompletableFuture<List<PublishResult>> publish(Collection<String> relayUrls, Event event) {
        return pool.publish(relayUrls, event);
    }

    /**
     * Publish to the author's write relays (or the fallback relays).
     */
    public CompletableFuture<List<PublishResult>> publishOutbox(Event event) {
        return pool.publish(router.routeEvent(event), event);
    }

    public SubscriptionHandle subscribeMany(Collection<String> relayUrls, List<Filter> filters,
                                            NostrEventListener listener) {
        return pool.subscribeMany(relayUrls, filters, listener);
    }

    // Connections

    public List<String> getConnectedRelays() {
        return pool.getConnectedRelays();
    }

    public List<RelayConnectionStatus> getConnectionStatuses() {
        return pool.getConnectionStatuses();
    }

    public void addConnectionListener(ConnectionEventListener listener) {
        pool.addConnectionListener(listener);
    }

    public boolean retryRelay(String url) {
        return pool.retry(url);
    }

    public int forceCleanup() {
        return pool.forceCleanup();
    }

    public RelayConnectionPool getPool() {
        return pool;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.close();
        pool.close();
        logger.info("Outbox client closed");
    }
}
