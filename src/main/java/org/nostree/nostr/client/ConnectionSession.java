package org.nostree.nostr.client;

import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.nostree.nostr.protocol.Event;
import org.nostree.nostr.protocol.Filter;
import org.nostree.nostr.protocol.MalformedMessageException;
import org.nostree.nostr.protocol.RelayMessage;
import org.nostree.nostr.protocol.RelayMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One managed WebSocket to one relay.
 * Owns reconnect/backoff and the bookkeeping of in-flight requests: request-scoped
 * queries (closed on EOSE), long-lived subscriptions (re-sent after a reconnect) and
 * publishes waiting for their {@code OK}. Instances are created and admitted by
 * {@link RelayConnectionPool}; callers never drive the socket directly.
 */
public class ConnectionSession extends WebSocketListener {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionSession.class);

    private final String url;
    private final RelayConnectionPool pool;

    private final Map<String, QueryWaiter> queries = new ConcurrentHashMap<>();
    private final Map<String, StreamEntry> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<PublishResult>> pendingPublishes = new ConcurrentHashMap<>();
    private final AtomicLong lastActivity = new AtomicLong(System.currentTimeMillis());
    // Pool requests that hold the session but have not registered their work yet
    private final AtomicInteger reservations = new AtomicInteger();

    // Guarded by this
    private SocketState state = SocketState.CLOSED;
    private WebSocket webSocket;
    private CompletableFuture<Void> openFuture;
    private ScheduledFuture<?> connectTimeoutTask;
    private ScheduledFuture<?> reconnectTask;
    private boolean wasConnected = false;
    private boolean closedByClient = false;
    private boolean degraded = false;
    private int reconnectAttempts = 0;
    private String lastError;

    ConnectionSession(String url, RelayConnectionPool pool) {
        this.url = url;
        this.pool = pool;
    }

    public String getUrl() {
        return url;
    }

    public synchronized SocketState getState() {
        return state;
    }

    public synchronized boolean isConnected() {
        return state == SocketState.OPEN;
    }

    public synchronized boolean isDegraded() {
        return degraded;
    }

    synchronized boolean isClosedByClient() {
        return closedByClient;
    }

    public long getLastActivity() {
        return lastActivity.get();
    }

    /**
     * Open the socket. Idempotent while connecting or open.
     *
     * @return Future completing when the socket is open; fails with
     *         {@link RelayConnectException} or {@link RelayTimeoutException}
     */
    CompletableFuture<Void> open() {
        synchronized (this) {
            if (degraded) {
                return failedFuture(new RelayConnectException(url,
                        "Relay is degraded after " + reconnectAttempts + " failed attempts: " + url));
            }
            if (state == SocketState.OPEN) {
                return CompletableFuture.completedFuture(null);
            }
            if (state == SocketState.CONNECTING) {
                return openFuture;
            }

            cancelTask(reconnectTask);
            reconnectTask = null;
            closedByClient = false;
            openFuture = new CompletableFuture<>();

            Request request;
            try {
                request = new Request.Builder().url(url).build();
            } catch (IllegalArgumentException e) {
                degraded = true;
                lastError = e.getMessage();
                openFuture.completeExceptionally(new RelayConnectException(url, "Invalid relay URL: " + url, e));
                return openFuture;
            }

            logger.info("Connecting to relay: {}", url);
            state = SocketState.CONNECTING;
            touch();
            WebSocket socket = pool.getHttpClient().newWebSocket(request, this);
            webSocket = socket;
            long timeoutMs = pool.getConnectTimeoutMs();
            connectTimeoutTask = pool.getScheduler().schedule(
                    () -> onConnectTimeout(socket, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS);
            return openFuture;
        }
    }

    /**
     * Join the current connection attempt without starting a new socket.
     * Only the pool opens sockets, under its capacity lock.
     *
     * @return Future completing when the socket is open; failed with
     *         {@link RelayConnectException} if the session is neither connecting nor open
     */
    CompletableFuture<Void> whenOpen() {
        synchronized (this) {
            if (state == SocketState.OPEN) {
                return CompletableFuture.completedFuture(null);
            }
            if (state == SocketState.CONNECTING) {
                return openFuture;
            }
            String reason = degraded
                    ? "Relay is degraded after " + reconnectAttempts + " failed attempts: " + url
                    : "Relay connection is closed: " + url;
            return failedFuture(new RelayConnectException(url, reason));
        }
    }

    /**
     * Write a frame.
     *
     * @param requestId Subscription or event ID the frame belongs to (for logging)
     * @param payload Encoded client frame
     * @throws NotConnectedException if the socket is not open
     */
    void send(String requestId, String payload) {
        WebSocket socket;
        synchronized (this) {
            if (state != SocketState.OPEN || webSocket == null) {
                throw new NotConnectedException(url);
            }
            socket = webSocket;
        }
        if (!socket.send(payload)) {
            throw new NotConnectedException(url);
        }
        touch();
        logger.debug("Sent [{}] to {}", requestId, url);
    }

    /**
     * Issue a request-scoped subscription. Events matching {@code filter} go to
     * {@code consumer} until EOSE, CLOSED or a disconnect completes the returned future.
     */
    CompletableFuture<Void> query(String subscriptionId, Filter filter, Consumer<Event> consumer) {
        QueryWaiter waiter = new QueryWaiter(filter, consumer);
        queries.put(subscriptionId, waiter);
        try {
            send(subscriptionId, RelayMessages.req(subscriptionId, Collections.singletonList(filter)));
        } catch (RelayException e) {
            queries.remove(subscriptionId);
            waiter.future.completeExceptionally(e);
        }
        return waiter.future;
    }

    /**
     * Abandon a query (deadline reached). Sends CLOSE if the socket is still open.
     */
    void cancelQuery(String subscriptionId) {
        QueryWaiter waiter = queries.remove(subscriptionId);
        if (waiter != null) {
            sendCloseQuietly(subscriptionId);
            waiter.future.complete(null);
        }
    }

    /**
     * Register a long-lived subscription and send its REQ. The REQ is re-sent after
     * every reconnect until {@link #unsubscribe(String)}.
     */
    void subscribe(String subscriptionId, List<Filter> filters, SessionSubscriber subscriber) {
        subscriptions.put(subscriptionId, new StreamEntry(filters, subscriber));
        try {
            send(subscriptionId, RelayMessages.req(subscriptionId, filters));
        } catch (RelayException e) {
            subscriptions.remove(subscriptionId);
            throw e;
        }
    }

    /**
     * Remove a long-lived subscription. Idempotent.
     */
    void unsubscribe(String subscriptionId) {
        if (subscriptions.remove(subscriptionId) != null) {
            sendCloseQuietly(subscriptionId);
        }
    }

    /**
     * Send an event and wait for the relay's {@code OK}.
     */
    CompletableFuture<PublishResult> publish(Event event) {
        CompletableFuture<PublishResult> future = new CompletableFuture<>();
        CompletableFuture<PublishResult> existing = pendingPublishes.putIfAbsent(event.getId(), future);
        if (existing != null) {
            return existing;
        }
        try {
            send(event.getId(), RelayMessages.event(event));
        } catch (RelayException e) {
            pendingPublishes.remove(event.getId());
            future.complete(PublishResult.failed(url, e.getMessage()));
        }
        return future;
    }

    /**
     * Stop waiting for an {@code OK} (publish deadline reached).
     */
    void forgetPublish(String eventId) {
        pendingPublishes.remove(eventId);
    }

    void reserve() {
        reservations.incrementAndGet();
    }

    void release() {
        reservations.decrementAndGet();
    }

    /**
     * Whether the session carries no queries, subscriptions, unacknowledged publishes
     * or reservations.
     */
    boolean hasNoInFlightWork() {
        return reservations.get() == 0 && queries.isEmpty() && subscriptions.isEmpty()
                && pendingPublishes.isEmpty();
    }

    /**
     * Whether the session is open or connecting, has no in-flight work, and saw no
     * traffic for at least {@code idleWindowMs}.
     */
    boolean isIdle(long now, long idleWindowMs) {
        return getState().isActive() && hasNoInFlightWork() && now - lastActivity.get() >= idleWindowMs;
    }

    /**
     * Clear the degraded mark so the pool hands out this session again.
     */
    synchronized void resetDegraded() {
        if (degraded) {
            logger.info("Relay {} re-enabled after degradation", url);
        }
        degraded = false;
        reconnectAttempts = 0;
        lastError = null;
    }

    synchronized RelayConnectionStatus status() {
        int inFlight = queries.size() + subscriptions.size() + pendingPublishes.size();
        return new RelayConnectionStatus(url, state, degraded, reconnectAttempts, lastError,
                lastActivity.get(), inFlight);
    }

    /**
     * Close the socket without reconnecting. Outstanding queries complete with what
     * they have, outstanding publishes fail.
     */
    void close() {
        WebSocket socket;
        CompletableFuture<Void> pendingOpen;
        synchronized (this) {
            closedByClient = true;
            cancelTask(reconnectTask);
            cancelTask(connectTimeoutTask);
            reconnectTask = null;
            connectTimeoutTask = null;
            socket = webSocket;
            webSocket = null;
            state = SocketState.CLOSED;
            pendingOpen = openFuture;
        }
        if (socket != null) {
            socket.close(1000, "Client disconnect");
        }
        if (pendingOpen != null && !pendingOpen.isDone()) {
            pendingOpen.completeExceptionally(new RelayConnectException(url, "Session closed by client"));
        }
        subscriptions.clear();
        failInFlight("Session closed by client");
        logger.debug("Closed session: {}", url);
    }

    // WebSocketListener

    @Override
    public void onOpen(WebSocket socket, Response response) {
        boolean reconnected;
        CompletableFuture<Void> pendingOpen;
        synchronized (this) {
            if (socket != webSocket || state != SocketState.CONNECTING) {
                socket.close(1000, "Stale connection");
                return;
            }
            state = SocketState.OPEN;
            reconnected = wasConnected;
            wasConnected = true;
            reconnectAttempts = 0;
            lastError = null;
            cancelTask(connectTimeoutTask);
            connectTimeoutTask = null;
            pendingOpen = openFuture;
        }
        touch();

        if (reconnected) {
            logger.info("Reconnected to relay: {}", url);
            pool.emitConnectionEvent("reconnected", url, null);
        } else {
            logger.info("Connected to relay: {}", url);
            pool.emitConnectionEvent("connect", url, null);
        }

        // Re-establish long-lived subscriptions
        for (Map.Entry<String, StreamEntry> entry : subscriptions.entrySet()) {
            if (!socket.send(RelayMessages.req(entry.getKey(), entry.getValue().filters))) {
                logger.warn("Failed to re-establish subscription {} on {}", entry.getKey(), url);
            }
        }

        if (pendingOpen != null) {
            pendingOpen.complete(null);
        }
    }

    @Override
    public void onMessage(WebSocket socket, String text) {
        synchronized (this) {
            if (socket != webSocket) {
                return;
            }
        }
        touch();
        try {
            handleRelayMessage(RelayMessages.parse(text));
        } catch (MalformedMessageException e) {
            logger.warn("Dropping malformed frame from {}: {}", url, e.getMessage());
        } catch (Exception e) {
            logger.error("Error handling relay message from {}", url, e);
        }
    }

    @Override
    public void onFailure(WebSocket socket, Throwable t, Response response) {
        String reason;
        if (t instanceof EOFException) {
            reason = "Connection closed unexpectedly";
        } else {
            reason = t != null && t.getMessage() != null ? t.getMessage() : "Unknown error";
        }
        handleDisconnect(socket, reason, t);
    }

    @Override
    public void onClosing(WebSocket socket, int code, String reason) {
        socket.close(1000, null);
    }

    @Override
    public void onClosed(WebSocket socket, int code, String reason) {
        String description = reason != null && !reason.isEmpty() ? reason : "Connection closed";
        handleDisconnect(socket, description + " (code: " + code + ")", null);
    }

    // Frame dispatch

    private void handleRelayMessage(RelayMessage message) {
        switch (message.getType()) {
            case EVENT:
                handleEvent(message.getSubscriptionId(), message.getEvent());
                break;
            case EOSE:
                handleEndOfStoredEvents(message.getSubscriptionId());
                break;
            case CLOSED:
                handleClosed(message.getSubscriptionId(), message.getMessage());
                break;
            case OK:
                handleOk(message);
                break;
            case NOTICE:
                logger.info("Relay notice from {}: {}", url, message.getMessage());
                break;
            default:
                logger.debug("Unknown message type from {}: {}", url, message.getMessage());
        }
    }

    private void handleEvent(String subscriptionId, Event event) {
        if (!pool.isAcceptable(event)) {
            logger.debug("Dropping event with invalid id from {}: {}", url, event);
            return;
        }
        QueryWaiter waiter = queries.get(subscriptionId);
        if (waiter != null) {
            if (waiter.filter.matches(event)) {
                waiter.consumer.accept(event);
            }
            return;
        }
        StreamEntry stream = subscriptions.get(subscriptionId);
        if (stream != null) {
            stream.subscriber.onEvent(url, event);
            return;
        }
        logger.debug("Event for unknown subscription {} from {}", subscriptionId, url);
    }

    private void handleEndOfStoredEvents(String subscriptionId) {
        QueryWaiter waiter = queries.remove(subscriptionId);
        if (waiter != null) {
            sendCloseQuietly(subscriptionId);
            waiter.future.complete(null);
            return;
        }
        StreamEntry stream = subscriptions.get(subscriptionId);
        if (stream != null) {
            stream.subscriber.onEndOfStoredEvents(url);
        }
        logger.debug("EOSE for subscription {} from {}", subscriptionId, url);
    }

    private void handleClosed(String subscriptionId, String reason) {
        logger.info("Relay {} closed subscription {}: {}", url, subscriptionId, reason);
        QueryWaiter waiter = queries.remove(subscriptionId);
        if (waiter != null) {
            waiter.future.complete(null);
            return;
        }
        StreamEntry stream = subscriptions.remove(subscriptionId);
        if (stream != null) {
            stream.subscriber.onClosed(url, reason);
        }
    }

    private void handleOk(RelayMessage message) {
        CompletableFuture<PublishResult> future = pendingPublishes.remove(message.getEventId());
        if (message.isAccepted()) {
            logger.debug("Event accepted by {}: {}", url, message.getEventId());
        } else {
            logger.warn("Event rejected by {}: {} - {}", url, message.getEventId(), message.getMessage());
        }
        if (future != null) {
            future.complete(new PublishResult(url, message.isAccepted(), message.getMessage()));
        }
    }

    // Disconnect and reconnect

    private void handleDisconnect(WebSocket socket, String reason, Throwable cause) {
        boolean wasOpen;
        boolean shouldReconnect;
        CompletableFuture<Void> pendingOpen;
        synchronized (this) {
            if (socket != webSocket) {
                return;
            }
            wasOpen = state == SocketState.OPEN;
            state = SocketState.CLOSED;
            webSocket = null;
            lastError = reason;
            cancelTask(connectTimeoutTask);
            connectTimeoutTask = null;
            pendingOpen = openFuture;
            shouldReconnect = !closedByClient && !pool.isClosed();
        }

        if (wasOpen) {
            logger.warn("Relay connection lost: {} ({})", url, reason);
        } else if (cause != null && !(cause instanceof EOFException)) {
            logger.warn("Relay connection failed: {} ({})", url, reason);
        } else {
            logger.info("Relay closed: {} ({})", url, reason);
        }

        if (pendingOpen != null && !pendingOpen.isDone()) {
            pendingOpen.completeExceptionally(new RelayConnectException(url, reason, cause));
        }
        failInFlight(reason);
        for (StreamEntry stream : subscriptions.values()) {
            stream.subscriber.onClosed(url, reason);
        }

        pool.onSessionClosed(this);
        if (wasOpen) {
            pool.emitConnectionEvent("disconnect", url, reason);
        }
        if (shouldReconnect) {
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        int attempt;
        long delay;
        synchronized (this) {
            if (closedByClient || degraded) {
                return;
            }
            attempt = ++reconnectAttempts;
            if (attempt > pool.getMaxReconnectAttempts()) {
                degraded = true;
            }
            delay = backoffDelay(pool.getReconnectIntervalMs(), pool.getMaxReconnectIntervalMs(), attempt);
            if (!degraded && pool.isAutoReconnect()) {
                reconnectTask = pool.getScheduler().schedule(
                        () -> pool.reconnect(this), delay, TimeUnit.MILLISECONDS);
            }
        }

        if (isDegraded()) {
            logger.warn("Relay {} marked degraded after {} failed attempts", url, attempt - 1);
            subscriptions.clear();
            pool.emitConnectionEvent("degraded", url, attempt - 1);
            return;
        }
        if (pool.isAutoReconnect()) {
            logger.info("Scheduling reconnect to {} in {}ms (attempt {})", url, delay, attempt);
            pool.emitConnectionEvent("reconnecting", url, attempt);
        }
    }

    /**
     * Re-arm the reconnect timer without counting a failed attempt
     * (the pool had no capacity when the previous timer fired).
     */
    synchronized void deferReconnect() {
        if (closedByClient || degraded) {
            return;
        }
        long delay = backoffDelay(pool.getReconnectIntervalMs(), pool.getMaxReconnectIntervalMs(),
                Math.max(1, reconnectAttempts));
        reconnectTask = pool.getScheduler().schedule(() -> pool.reconnect(this), delay, TimeUnit.MILLISECONDS);
    }

    private void onConnectTimeout(WebSocket socket, long timeoutMs) {
        CompletableFuture<Void> pendingOpen;
        synchronized (this) {
            if (socket != webSocket || state != SocketState.CONNECTING) {
                return;
            }
            pendingOpen = openFuture;
        }
        logger.warn("Connection to {} timed out after {}ms", url, timeoutMs);
        if (pendingOpen != null) {
            pendingOpen.completeExceptionally(new RelayTimeoutException(url, "Connect", timeoutMs));
        }
        // Triggers onFailure, which closes the session and schedules the reconnect
        socket.cancel();
    }

    /**
     * Exponential backoff: {@code base * 2^(attempt-1)}, capped at {@code max}.
     */
    static long backoffDelay(long baseDelayMs, long maxDelayMs, int attempt) {
        if (attempt <= 1) {
            return Math.min(baseDelayMs, maxDelayMs);
        }
        long delay = (long) (baseDelayMs * Math.pow(2, attempt - 1));
        return Math.min(delay, maxDelayMs);
    }

    private void failInFlight(String reason) {
        List<QueryWaiter> waiters = new ArrayList<>(queries.values());
        queries.clear();
        for (QueryWaiter waiter : waiters) {
            waiter.future.complete(null);
        }
        List<CompletableFuture<PublishResult>> publishes = new ArrayList<>(pendingPublishes.values());
        pendingPublishes.clear();
        for (CompletableFuture<PublishResult> publish : publishes) {
            publish.complete(PublishResult.failed(url, reason));
        }
    }

    private void sendCloseQuietly(String subscriptionId) {
        try {
            send(subscriptionId, RelayMessages.close(subscriptionId));
        } catch (NotConnectedException e) {
            logger.debug("Skipping CLOSE for {} on {}: not connected", subscriptionId, url);
        }
    }

    private void touch() {
        lastActivity.set(System.currentTimeMillis());
    }

    private static void cancelTask(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static <T> CompletableFuture<T> failedFuture(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    @Override
    public String toString() {
        return "ConnectionSession{" + url + ", " + getState() + (isDegraded() ? ", degraded" : "") + '}';
    }

    // Inner classes

    private static class QueryWaiter {
        final Filter filter;
        final Consumer<Event> consumer;
        final CompletableFuture<Void> future = new CompletableFuture<>();

        QueryWaiter(Filter filter, Consumer<Event> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }
    }

    private static class StreamEntry {
        final List<Filter> filters;
        final SessionSubscriber subscriber;

        StreamEntry(List<Filter> filters, SessionSubscriber subscriber) {
            this.filters = filters;
            this.subscriber = subscriber;
        }
    }
}
