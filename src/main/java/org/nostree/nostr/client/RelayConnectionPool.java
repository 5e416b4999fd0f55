package org.nostree.nostr.client;

import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.nostree.nostr.protocol.Event;
import org.nostree.nostr.protocol.EventIds;
import org.nostree.nostr.protocol.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of relay sessions with request/response queries, streaming
 * subscriptions and publishing across many relays.
 *
 * <p>The pool is the only owner of live sockets. At most {@code maxConnections}
 * sessions are connecting or open at any time: new sessions and reconnects are
 * admitted under one lock, which first evicts the least-recently-used session
 * without in-flight work and otherwise waits up to {@code connectionWaitMs} for
 * capacity.
 *
 * <p>Multi-relay calls never fail because of a single relay. A relay that cannot be
 * reached contributes no events to {@link #querySync} and a failed
 * {@link PublishResult} to {@link #publish}.
 */
public class RelayConnectionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RelayConnectionPool.class);

    public static final int DEFAULT_MAX_CONNECTIONS = 20;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5000;
    public static final int DEFAULT_CONNECTION_WAIT_MS = 2000;
    public static final int DEFAULT_QUERY_TIMEOUT_MS = 5000;
    public static final int DEFAULT_PUBLISH_TIMEOUT_MS = 5000;
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 5 * 60 * 1000L;
    public static final int DEFAULT_RECONNECT_INTERVAL_MS = 1000;
    public static final int DEFAULT_MAX_RECONNECT_INTERVAL_MS = 30000;
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;
    private static final int DEFAULT_PING_INTERVAL_MS = 30000;
    private static final long CLEANUP_INTERVAL_MS = 60000;

    private final OkHttpClient httpClient;
    private final boolean ownsHttpClient;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition capacityAvailable = lock.newCondition();
    private final Map<String, ConnectionSession> sessions = new HashMap<>();
    private final Map<String, PoolSubscription> subscriptions = new ConcurrentHashMap<>();
    private final List<ConnectionEventListener> connectionListeners = new CopyOnWriteArrayList<>();
    private final ScheduledFuture<?> cleanupTask;

    private volatile boolean closed = false;

    // Configuration options
    private volatile int maxConnections = DEFAULT_MAX_CONNECTIONS;
    private volatile long connectionWaitMs = DEFAULT_CONNECTION_WAIT_MS;
    private volatile long connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
    private volatile long queryTimeoutMs = DEFAULT_QUERY_TIMEOUT_MS;
    private volatile long publishTimeoutMs = DEFAULT_PUBLISH_TIMEOUT_MS;
    private volatile long idleTimeoutMs = DEFAULT_IDLE_TIMEOUT_MS;
    private volatile long reconnectIntervalMs = DEFAULT_RECONNECT_INTERVAL_MS;
    private volatile long maxReconnectIntervalMs = DEFAULT_MAX_RECONNECT_INTERVAL_MS;
    private volatile int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;
    private volatile boolean autoReconnect = true;
    private volatile boolean verifyEventIds = true;

    /**
     * Create a pool with its own OkHttp client.
     */
    public RelayConnectionPool() {
        this(defaultHttpClient(), true);
    }

    /**
     * Create a pool on a caller-supplied OkHttp client. The client is not shut down
     * by {@link #close()}.
     *
     * @param httpClient Client used to open WebSockets; its read timeout should be 0
     */
    public RelayConnectionPool(OkHttpClient httpClient) {
        this(httpClient, false);
    }

    private RelayConnectionPool(OkHttpClient httpClient, boolean ownsHttpClient) {
        this.httpClient = httpClient;
        this.ownsHttpClient = ownsHttpClient;
        this.scheduler = Executors.newScheduledThreadPool(1, daemonThreads("relay-pool-timer"));
        this.workers = Executors.newCachedThreadPool(daemonThreads("relay-pool-worker"));
        widenDispatcher(DEFAULT_MAX_CONNECTIONS);
        this.cleanupTask = scheduler.scheduleWithFixedDelay(this::periodicCleanup,
                CLEANUP_INTERVAL_MS, CLEANUP_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(DEFAULT_CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS)
            .readTimeout(0, TimeUnit.SECONDS)  // No read timeout for WebSocket
            .writeTimeout(DEFAULT_CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS)
            .pingInterval(DEFAULT_PING_INTERVAL_MS, TimeUnit.MILLISECONDS)  // OkHttp built-in ping
            .build();
    }

    // Configuration

    public int getMaxConnections() { return maxConnections; }

    /**
     * Set the ceiling on connecting + open sessions.
     *
     * @param maxConnections Maximum simultaneous sockets (default: 20)
     */
    public void setMaxConnections(int maxConnections) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1");
        }
        this.maxConnections = maxConnections;
        widenDispatcher(maxConnections);
    }

    public long getConnectionWaitMs() { return connectionWaitMs; }

    /**
     * Set how long {@link #getConnection(String)} waits for capacity before failing
     * with {@link MaxConnectionsExceededException}.
     */
    public void setConnectionWaitMs(long connectionWaitMs) { this.connectionWaitMs = connectionWaitMs; }

    public long getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

    public long getQueryTimeoutMs() { return queryTimeoutMs; }

    /**
     * Set the default deadline of {@link #querySync(Collection, Filter)}.
     */
    public void setQueryTimeoutMs(long queryTimeoutMs) { this.queryTimeoutMs = queryTimeoutMs; }

    public long getPublishTimeoutMs() { return publishTimeoutMs; }
    public void setPublishTimeoutMs(long publishTimeoutMs) { this.publishTimeoutMs = publishTimeoutMs; }

    public long getIdleTimeoutMs() { return idleTimeoutMs; }

    /**
     * Set the idle window after which {@link #forceCleanup()} closes a session.
     * The periodic cleanup uses the same window; 0 disables it.
     */
    public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }

    public long getReconnectIntervalMs() { return reconnectIntervalMs; }

    /**
     * Set the initial reconnect interval.
     *
     * @param intervalMs Initial reconnect interval in milliseconds
     */
    public void setReconnectIntervalMs(long intervalMs) { this.reconnectIntervalMs = intervalMs; }

    public long getMaxReconnectIntervalMs() { return maxReconnectIntervalMs; }

    /**
     * Set the maximum reconnect interval (for exponential backoff).
     *
     * @param maxIntervalMs Maximum reconnect interval in milliseconds
     */
    public void setMaxReconnectIntervalMs(long maxIntervalMs) { this.maxReconnectIntervalMs = maxIntervalMs; }

    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }

    /**
     * Set the retry budget: a session failing more often than this in a row is
     * degraded until {@link #retry(String)} or {@link #resetConnectionAttempts()}.
     */
    public void setMaxReconnectAttempts(int maxReconnectAttempts) { this.maxReconnectAttempts = maxReconnectAttempts; }

    public boolean isAutoReconnect() { return autoReconnect; }

    /**
     * Set whether automatic reconnection is enabled.
     *
     * @param autoReconnect true to enable auto-reconnect (default: true)
     */
    public void setAutoReconnect(boolean autoReconnect) { this.autoReconnect = autoReconnect; }

    public boolean isVerifyEventIds() { return verifyEventIds; }

    /**
     * Drop received events whose ID does not match their content (default: true).
     */
    public void setVerifyEventIds(boolean verifyEventIds) { this.verifyEventIds = verifyEventIds; }

    /**
     * Add a connection event listener.
     *
     * @param listener Listener for connection events
     */
    public void addConnectionListener(ConnectionEventListener listener) {
        connectionListeners.add(listener);
    }

    /**
     * Remove a connection event listener.
     *
     * @param listener Listener to remove
     */
    public void removeConnectionListener(ConnectionEventListener listener) {
        connectionListeners.remove(listener);
    }

    // Session management

    /**
     * Get the session for a relay, creating and opening it if needed.
     * The returned session may still be connecting.
     *
     * @param url Relay URL (normalized with {@link RelayUrls#normalize(String)})
     * @return Connecting or open session
     * @throws MaxConnectionsExceededException if no capacity frees up within the wait period
     * @throws RelayConnectException if the relay is degraded
     * @throws IllegalArgumentException if the URL is not a relay URL
     */
    public ConnectionSession getConnection(String url) {
        return connect(url, false);
    }

    /**
     * Get a session that cannot be evicted until {@link ConnectionSession#release()}.
     */
    private ConnectionSession acquire(String url) {
        return connect(url, true);
    }

    private ConnectionSession connect(String url, boolean reserve) {
        String relayUrl = RelayUrls.normalize(url);
        long waitMs = connectionWaitMs;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitMs);

        lock.lock();
        try {
            while (true) {
                ensureOpen();
                ConnectionSession session = sessions.get(relayUrl);
                if (session != null && session.isDegraded()) {
                    throw new RelayConnectException(relayUrl, "Relay is degraded: " + relayUrl);
                }
                if (session != null && session.getState().isActive()) {
                    if (reserve) {
                        session.reserve();
                    }
                    return session;
                }
                if (activeCount() < maxConnections || evictLeastRecentlyUsed(session)) {
                    if (session == null) {
                        session = new ConnectionSession(relayUrl, this);
                        sessions.put(relayUrl, session);
                    }
                    if (reserve) {
                        session.reserve();
                    }
                    session.open();
                    return session;
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new MaxConnectionsExceededException(relayUrl, maxConnections, waitMs);
                }
                logger.debug("Pool at capacity ({}), waiting for a slot for {}", maxConnections, relayUrl);
                try {
                    capacityAvailable.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MaxConnectionsExceededException(relayUrl, maxConnections, waitMs);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of sessions currently connecting or open.
     */
    public int getActiveConnectionCount() {
        lock.lock();
        try {
            return activeCount();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of relays with an open socket.
     */
    public List<String> getConnectedRelays() {
        List<String> connected = new ArrayList<>();
        for (ConnectionSession session : snapshotSessions()) {
            if (session.isConnected()) {
                connected.add(session.getUrl());
            }
        }
        Collections.sort(connected);
        return connected;
    }

    public boolean isConnected(String url) {
        RelayConnectionStatus status = getConnectionStatus(url);
        return status != null && status.isConnected();
    }

    /**
     * Get connection status for all known relays.
     */
    public List<RelayConnectionStatus> getConnectionStatuses() {
        List<RelayConnectionStatus> statuses = new ArrayList<>();
        for (ConnectionSession session : snapshotSessions()) {
            statuses.add(session.status());
        }
        return statuses;
    }

    /**
     * Get connection status for a relay, or null if the pool never saw it.
     */
    public RelayConnectionStatus getConnectionStatus(String url) {
        String relayUrl = RelayUrls.tryNormalize(url).orElse(url);
        ConnectionSession session;
        lock.lock();
        try {
            session = sessions.get(relayUrl);
        } finally {
            lock.unlock();
        }
        return session != null ? session.status() : null;
    }

    /**
     * Re-enable a degraded relay so that the next request tries it again.
     *
     * @return true if the relay was degraded
     */
    public boolean retry(String url) {
        String relayUrl = RelayUrls.normalize(url);
        lock.lock();
        try {
            ConnectionSession session = sessions.get(relayUrl);
            if (session == null || !session.isDegraded()) {
                return false;
            }
            session.resetDegraded();
            sessions.remove(relayUrl);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-enable every degraded relay.
     */
    public void resetConnectionAttempts() {
        lock.lock();
        try {
            sessions.values().removeIf(session -> {
                if (session.isDegraded()) {
                    session.resetDegraded();
                    return true;
                }
                return false;
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close sessions that have no in-flight work and were idle for longer than the
     * idle timeout. Callable on visibility changes or memory pressure.
     *
     * @return Number of sessions closed
     */
    public int forceCleanup() {
        return closeIdleSessions(idleTimeoutMs);
    }

    private void periodicCleanup() {
        if (idleTimeoutMs > 0 && !closed) {
            try {
                closeIdleSessions(idleTimeoutMs);
            } catch (Exception e) {
                logger.error("Idle session cleanup failed", e);
            }
        }
    }

    private int closeIdleSessions(long idleWindowMs) {
        List<ConnectionSession> idle = new ArrayList<>();
        long now = System.currentTimeMillis();
        lock.lock();
        try {
            for (ConnectionSession session : sessions.values()) {
                if (session.isIdle(now, idleWindowMs)) {
                    idle.add(session);
                }
            }
            for (ConnectionSession session : idle) {
                sessions.remove(session.getUrl());
                session.close();
            }
            if (!idle.isEmpty()) {
                capacityAvailable.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (!idle.isEmpty()) {
            logger.info("Closed {} idle relay sessions", idle.size());
        }
        return idle.size();
    }

    /**
     * Close the sessions of specific relays, whatever they are doing.
     */
    public void close(Collection<String> relayUrls) {
        lock.lock();
        try {
            for (String relayUrl : RelayUrls.normalizeAll(relayUrls)) {
                ConnectionSession session = sessions.remove(relayUrl);
                if (session != null) {
                    session.close();
                }
            }
            capacityAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close every session and stop the pool's timers. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        logger.info("Closing relay pool");
        closed = true;

        for (PoolSubscription subscription : new ArrayList<>(subscriptions.values())) {
            subscription.close();
        }
        lock.lock();
        try {
            for (ConnectionSession session : sessions.values()) {
                session.close();
            }
            sessions.clear();
            capacityAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        cleanupTask.cancel(false);
        scheduler.shutdownNow();
        workers.shutdownNow();
        if (ownsHttpClient) {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // Requests

    /**
     * Query relays with the default timeout.
     *
     * @see #querySync(Collection, Filter, long)
     */
    public CompletableFuture<List<Event>> querySync(Collection<String> relayUrls, Filter filter) {
        return querySync(relayUrls, filter, queryTimeoutMs);
    }

    /**
     * Query several relays in parallel and collect stored events until every relay has
     * sent EOSE, failed, or the deadline passed.
     *
     * @param relayUrls Relays to query
     * @param filter Filter sent to every relay
     * @param timeoutMs Deadline for the whole call
     * @return Union of the events received, de-duplicated by ID; never completes
     *         exceptionally because of relay failures
     */
    public CompletableFuture<List<Event>> querySync(Collection<String> relayUrls, Filter filter, long timeoutMs) {
        if (closed) {
            return failedFuture(new IllegalStateException("RelayConnectionPool has been closed"));
        }
        List<String> urls = RelayUrls.normalizeAll(relayUrls);
        if (urls.isEmpty()) {
            return CompletableFuture.completedFuture(new ArrayList<>());
        }

        String subscriptionId = newSubscriptionId("q");
        Map<String, Event> collected = new ConcurrentHashMap<>();
        Map<String, ConnectionSession> querying = new ConcurrentHashMap<>();
        Set<String> pending = ConcurrentHashMap.newKeySet();
        pending.addAll(urls);
        CompletableFuture<List<Event>> result = new CompletableFuture<>();

        List<CompletableFuture<Void>> perRelay = new ArrayList<>();
        for (String url : urls) {
            CompletableFuture<Void> relayQuery = CompletableFuture
                .supplyAsync(() -> acquire(url), workers)
                .thenCompose(session -> session.whenOpen().thenCompose(v -> {
                    if (result.isDone()) {
                        // Deadline passed while this relay was connecting
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    querying.put(url, session);
                    CompletableFuture<Void> query = session.query(subscriptionId, filter, event -> {
                        if (event.getId() != null) {
                            collected.putIfAbsent(event.getId(), event);
                        }
                    });
                    if (result.isDone()) {
                        session.cancelQuery(subscriptionId);
                    }
                    return query;
                }).whenComplete((v, error) -> session.release()))
                .handle((v, error) -> {
                    if (error != null) {
                        logger.warn("Query {} failed on {}: {}", subscriptionId, url, describe(error));
                    }
                    pending.remove(url);
                    signalCapacity();
                    return null;
                });
            perRelay.add(relayQuery);
        }

        Runnable finish = () -> {
            if (result.complete(new ArrayList<>(collected.values()))) {
                for (ConnectionSession session : querying.values()) {
                    session.cancelQuery(subscriptionId);
                }
                if (!pending.isEmpty()) {
                    logger.info("Query {} timed out after {}ms on {}", subscriptionId, timeoutMs, pending);
                }
                logger.debug("Query {} collected {} events from {} relays", subscriptionId,
                        collected.size(), urls.size());
            }
        };

        ScheduledFuture<?> deadline = scheduler.schedule(finish, timeoutMs, TimeUnit.MILLISECONDS);
        CompletableFuture.allOf(perRelay.toArray(new CompletableFuture[0])).whenComplete((v, e) -> {
            deadline.cancel(false);
            finish.run();
        });
        return result;
    }

    /**
     * Publish with the default per-relay timeout.
     *
     * @see #publish(Collection, Event, long)
     */
    public CompletableFuture<List<PublishResult>> publish(Collection<String> relayUrls, Event event) {
        return publish(relayUrls, event, publishTimeoutMs);
    }

    /**
     * Send an event to several relays in parallel, each with its own timeout.
     *
     * @param relayUrls Relays to publish to
     * @param event Signed event
     * @param timeoutMs Deadline per relay
     * @return One result per relay in input order; never completes exceptionally
     *         because of relay failures
     */
    public CompletableFuture<List<PublishResult>> publish(Collection<String> relayUrls, Event event, long timeoutMs) {
        if (closed) {
            return failedFuture(new IllegalStateException("RelayConnectionPool has been closed"));
        }
        if (event == null || event.getId() == null) {
            return failedFuture(new IllegalArgumentException("Event must have an id"));
        }
        List<String> urls = RelayUrls.normalizeAll(relayUrls);

        List<CompletableFuture<PublishResult>> perRelay = new ArrayList<>();
        for (String url : urls) {
            AtomicReference<ConnectionSession> used = new AtomicReference<>();
            AtomicBoolean settled = new AtomicBoolean(false);
            AtomicBoolean released = new AtomicBoolean(false);
            CompletableFuture<PublishResult> relayPublish = CompletableFuture
                .supplyAsync(() -> acquire(url), workers)
                .thenCompose(session -> {
                    used.set(session);
                    if (settled.get()) {
                        // Timed out while waiting for a slot
                        releaseOnce(session, released);
                        return failedFuture(new TimeoutException());
                    }
                    return session.whenOpen().thenCompose(v -> session.publish(event));
                })
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    ConnectionSession session = used.get();
                    if (session != null) {
                        session.forgetPublish(event.getId());
                    }
                    String reason = unwrap(error) instanceof TimeoutException
                            ? "timed out after " + timeoutMs + "ms"
                            : describe(error);
                    logger.warn("Publish of {} to {} failed: {}", event.getId(), url, reason);
                    return PublishResult.failed(url, reason);
                })
                .whenComplete((result, error) -> {
                    settled.set(true);
                    ConnectionSession session = used.get();
                    if (session != null) {
                        releaseOnce(session, released);
                    }
                    signalCapacity();
                });
            perRelay.add(relayPublish);
        }

        return CompletableFuture.allOf(perRelay.toArray(new CompletableFuture[0])).thenApply(v -> {
            List<PublishResult> results = new ArrayList<>();
            for (CompletableFuture<PublishResult> relayPublish : perRelay) {
                results.add(relayPublish.join());
            }
            return results;
        });
    }

    /**
     * Open a long-lived subscription on several relays.
     *
     * @param relayUrls Relays to subscribe on
     * @param filters Filters of the subscription (at least one)
     * @param listener Receives events, a single EOSE once all relays settled, and per-relay errors
     * @return Handle whose {@link SubscriptionHandle#close()} unsubscribes everywhere
     */
    public SubscriptionHandle subscribeMany(Collection<String> relayUrls, List<Filter> filters,
                                            NostrEventListener listener) {
        ensureOpen();
        if (filters == null || filters.isEmpty()) {
            throw new IllegalArgumentException("At least one filter is required");
        }
        List<String> urls = RelayUrls.normalizeAll(relayUrls);
        PoolSubscription subscription = new PoolSubscription(newSubscriptionId("s"),
                new ArrayList<>(filters), listener, urls);
        subscriptions.put(subscription.getId(), subscription);

        if (urls.isEmpty()) {
            subscription.settleIfDone();
        }
        for (String url : urls) {
            CompletableFuture
                .supplyAsync(() -> acquire(url), workers)
                .thenCompose(session -> session.whenOpen()
                    .thenRun(() -> subscription.attach(url, session))
                    .whenComplete((v, error) -> session.release()))
                .exceptionally(error -> {
                    subscription.relayFailed(url, describe(error));
                    return null;
                });
        }
        logger.debug("Subscribed {} on {} relays", subscription.getId(), urls.size());
        return subscription;
    }

    /**
     * Subscribe with a single filter.
     */
    public SubscriptionHandle subscribeMany(Collection<String> relayUrls, Filter filter,
                                            NostrEventListener listener) {
        return subscribeMany(relayUrls, Collections.singletonList(filter), listener);
    }

    // Package-private hooks for ConnectionSession

    OkHttpClient getHttpClient() {
        return httpClient;
    }

    ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    boolean isAcceptable(Event event) {
        return event != null && (!verifyEventIds || EventIds.hasValidId(event));
    }

    /**
     * Admit a reconnect under the pool lock so that it respects the ceiling.
     */
    void reconnect(ConnectionSession session) {
        lock.lock();
        try {
            if (closed || sessions.get(session.getUrl()) != session || session.isClosedByClient()) {
                return;
            }
            if (session.getState().isActive()) {
                return;
            }
            if (activeCount() < maxConnections || evictLeastRecentlyUsed(session)) {
                logger.info("Attempting to reconnect to relay: {}", session.getUrl());
                session.open();
            } else {
                logger.info("Pool at capacity, deferring reconnect to {}", session.getUrl());
                session.deferReconnect();
            }
        } finally {
            lock.unlock();
        }
    }

    void onSessionClosed(ConnectionSession session) {
        signalCapacity();
    }

    /**
     * Wake callers waiting in {@link #getConnection(String)}: a session closed or
     * finished its in-flight work and may now be evicted.
     */
    private void signalCapacity() {
        lock.lock();
        try {
            capacityAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emit a connection event to all listeners.
     */
    void emitConnectionEvent(String eventType, String relayUrl, Object extra) {
        for (ConnectionEventListener listener : connectionListeners) {
            try {
                switch (eventType) {
                    case "connect":
                        listener.onConnect(relayUrl);
                        break;
                    case "disconnect":
                        listener.onDisconnect(relayUrl, (String) extra);
                        break;
                    case "reconnecting":
                        listener.onReconnecting(relayUrl, (Integer) extra);
                        break;
                    case "reconnected":
                        listener.onReconnected(relayUrl);
                        break;
                    case "degraded":
                        listener.onDegraded(relayUrl, (Integer) extra);
                        break;
                    default:
                        logger.debug("Unknown connection event: {}", eventType);
                }
            } catch (Exception e) {
                logger.warn("Error in connection listener", e);
            }
        }
    }

    // Helpers

    /** Caller holds the lock. */
    private int activeCount() {
        int active = 0;
        for (ConnectionSession session : sessions.values()) {
            if (session.getState().isActive()) {
                active++;
            }
        }
        return active;
    }

    /**
     * Close the least-recently-used active session without in-flight work.
     * Caller holds the lock.
     *
     * @param exclude Session that must survive (the one asking for a slot), may be null
     * @return true if a session was evicted
     */
    private boolean evictLeastRecentlyUsed(ConnectionSession exclude) {
        ConnectionSession victim = null;
        for (ConnectionSession session : sessions.values()) {
            if (session == exclude || !session.getState().isActive() || !session.hasNoInFlightWork()) {
                continue;
            }
            if (victim == null || session.getLastActivity() < victim.getLastActivity()) {
                victim = session;
            }
        }
        if (victim == null) {
            return false;
        }
        logger.info("Evicting least recently used relay session: {}", victim.getUrl());
        sessions.remove(victim.getUrl());
        victim.close();
        return true;
    }

    private static void releaseOnce(ConnectionSession session, AtomicBoolean released) {
        if (released.compareAndSet(false, true)) {
            session.release();
        }
    }

    private List<ConnectionSession> snapshotSessions() {
        lock.lock();
        try {
            return new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("RelayConnectionPool has been closed");
        }
    }

    private void widenDispatcher(int connections) {
        // Every WebSocket holds a dispatcher slot; the defaults (64 total, 5 per host) are too small
        Dispatcher dispatcher = httpClient.dispatcher();
        int needed = Math.max(64, connections * 2);
        if (dispatcher.getMaxRequests() < needed) {
            dispatcher.setMaxRequests(needed);
        }
        if (dispatcher.getMaxRequestsPerHost() < needed) {
            dispatcher.setMaxRequestsPerHost(needed);
        }
    }

    private static String newSubscriptionId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 12);
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static <T> CompletableFuture<T> failedFuture(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    // Inner classes

    private class PoolSubscription implements SubscriptionHandle, SessionSubscriber {
        private final String id;
        private final List<Filter> filters;
        private final NostrEventListener listener;
        private final Map<String, ConnectionSession> attached = new HashMap<>();
        private final Set<String> unsettled;
        private final AtomicBoolean closedFlag = new AtomicBoolean(false);
        private final AtomicBoolean eoseFired = new AtomicBoolean(false);

        PoolSubscription(String id, List<Filter> filters, NostrEventListener listener, List<String> relays) {
            this.id = id;
            this.filters = filters;
            this.listener = listener;
            this.unsettled = ConcurrentHashMap.newKeySet();
            this.unsettled.addAll(relays);
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public synchronized Set<String> getRelays() {
            return Collections.unmodifiableSet(new LinkedHashSet<>(attached.keySet()));
        }

        @Override
        public boolean isClosed() {
            return closedFlag.get();
        }

        synchronized void attach(String url, ConnectionSession session) {
            if (closedFlag.get()) {
                return;
            }
            try {
                session.subscribe(id, filters, this);
                attached.put(url, session);
            } catch (RelayException e) {
                relayFailed(url, e.getMessage());
            }
        }

        void relayFailed(String url, String reason) {
            logger.warn("Subscription {} failed on {}: {}", id, url, reason);
            if (!closedFlag.get()) {
                notifyError(url, reason);
            }
            settle(url);
        }

        void settleIfDone() {
            if (unsettled.isEmpty() && !closedFlag.get() && eoseFired.compareAndSet(false, true)) {
                try {
                    listener.onEndOfStoredEvents(id);
                } catch (Exception e) {
                    logger.warn("Error in subscription listener", e);
                }
            }
        }

        private void settle(String url) {
            unsettled.remove(url);
            settleIfDone();
        }

        private void notifyError(String url, String reason) {
            try {
                listener.onError(url, reason);
            } catch (Exception e) {
                logger.warn("Error in subscription listener", e);
            }
        }

        @Override
        public void onEvent(String relayUrl, Event event) {
            if (closedFlag.get()) {
                return;
            }
            try {
                listener.onEvent(relayUrl, event);
            } catch (Exception e) {
                logger.warn("Error in subscription listener", e);
            }
        }

        @Override
        public void onEndOfStoredEvents(String relayUrl) {
            settle(relayUrl);
        }

        @Override
        public void onClosed(String relayUrl, String reason) {
            if (!closedFlag.get()) {
                notifyError(relayUrl, reason);
            }
            settle(relayUrl);
        }

        @Override
        public void close() {
            if (!closedFlag.compareAndSet(false, true)) {
                return;
            }
            List<ConnectionSession> sessionsToRelease;
            synchronized (this) {
                sessionsToRelease = new ArrayList<>(attached.values());
                attached.clear();
            }
            for (ConnectionSession session : sessionsToRelease) {
                session.unsubscribe(id);
            }
            subscriptions.remove(id);
            if (!sessionsToRelease.isEmpty()) {
                signalCapacity();
            }
            logger.debug("Unsubscribed: {}", id);
        }
    }
}
