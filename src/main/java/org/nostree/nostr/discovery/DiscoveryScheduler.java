package org.nostree.nostr.discovery;

import org.nostree.nostr.outbox.DiscoveryResult;
import org.nostree.nostr.outbox.OutboxRouter;
import org.nostree.nostr.storage.RoutingStorage;
import org.nostree.nostr.storage.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs outbox discovery in the background, one run at a time.
 *
 * <p>A run splits its users into batches and discovers them one batch after another,
 * pausing between batches and stopping early when cancelled. Triggers that arrive
 * while a run is in progress are ignored. All runs and the periodic refresh execute
 * on a single scheduler thread.
 */
public class DiscoveryScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryScheduler.class);

    private final OutboxRouter router;
    private final RoutingStorage storage;
    private final DiscoveryConfig config;
    private final DiscoveryState state;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<DiscoveryListener> listeners = new CopyOnWriteArrayList<>();

    private volatile CancellationToken currentToken;
    private volatile DiscoveryProgress lastProgress = DiscoveryProgress.NONE;
    private volatile ScheduledFuture<?> periodicTask;

    public DiscoveryScheduler(OutboxRouter router, SettingsStore settings, DiscoveryConfig config) {
        this.router = router;
        this.storage = router.getStorage();
        this.config = config;
        this.state = new DiscoveryState(settings, storage);
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "outbox-discovery");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(DiscoveryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DiscoveryListener listener) {
        listeners.remove(listener);
    }

    // Triggers

    /**
     * Discover the given users, skipping those already discovered in the current cycle.
     *
     * @return Outcome of the run; {@link DiscoveryOutcome.Status#SKIPPED} if a run is in progress
     */
    public CompletableFuture<DiscoveryOutcome> discoverForUsers(Collection<String> userIds) {
        return trigger(userIds, EnumSet.of(DiscoveryTrigger.EXPLICIT));
    }

    /**
     * Start a run if any of these holds: this is the first check and no run was ever recorded, the
     * routing table is empty, the refresh interval has elapsed, or the minimum interval
     * has elapsed. The two full-refresh conditions also rediscover users seen earlier
     * in the cycle.
     */
    public CompletableFuture<DiscoveryOutcome> checkAndDiscover(Collection<String> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return CompletableFuture.completedFuture(
                    DiscoveryOutcome.skipped(EnumSet.noneOf(DiscoveryTrigger.class), "No users"));
        }
        Set<DiscoveryTrigger> triggers = EnumSet.noneOf(DiscoveryTrigger.class);
        long now = config.getClock().millis();
        long sinceLast = now - state.getLastDiscoveryAt();

        if (state.consumeFirstCheck()) {
            triggers.add(DiscoveryTrigger.FIRST_LOAD);
        }
        if (isRoutingTableEmpty()) {
            triggers.add(DiscoveryTrigger.EMPTY_TABLE);
        }
        if (sinceLast >= config.getRefreshIntervalMs()) {
            triggers.add(DiscoveryTrigger.REFRESH_DUE);
        }
        if (sinceLast >= config.getMinIntervalMs()) {
            triggers.add(DiscoveryTrigger.MIN_INTERVAL_ELAPSED);
        }

        if (triggers.isEmpty()) {
            logger.debug("Skipping outbox discovery, last run {} min ago",
                    TimeUnit.MILLISECONDS.toMinutes(sinceLast));
            return CompletableFuture.completedFuture(DiscoveryOutcome.skipped(triggers, "Too soon since last run"));
        }
        logger.info("Outbox discovery check triggered by {}", triggers);
        return trigger(userIds, triggers);
    }

    /**
     * Refresh all users from {@code userSupplier} every refresh interval. Calling it
     * again replaces the previous schedule.
     */
    public synchronized void start(Supplier<? extends Collection<String>> userSupplier) {
        stop();
        long interval = config.getRefreshIntervalMs();
        periodicTask = executor.scheduleWithFixedDelay(() -> {
            try {
                Collection<String> users = userSupplier.get();
                if (users != null && !users.isEmpty()) {
                    trigger(users, EnumSet.of(DiscoveryTrigger.PERIODIC));
                }
            } catch (Exception e) {
                logger.error("Periodic outbox refresh failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        logger.info("Periodic outbox refresh every {} min", TimeUnit.MILLISECONDS.toMinutes(interval));
    }

    /**
     * Stop the periodic refresh. A run in progress continues.
     */
    public synchronized void stop() {
        if (periodicTask != null) {
            periodicTask.cancel(false);
            periodicTask = null;
        }
    }

    /**
     * Cancel the run in progress after its current batch.
     *
     * @return true if a run was cancelled
     */
    public boolean cancel() {
        CancellationToken token = currentToken;
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    // State

    public boolean isDiscovering() {
        return running.get();
    }

    public boolean hasCompletedInitialDiscovery() {
        return state.isInitialDiscoveryComplete();
    }

    /**
     * Progress of the current run, or of the last run when idle.
     */
    public DiscoveryProgress discoveryProgress() {
        DiscoverySession session = state.getCurrentSession();
        return session != null ? session.getProgress() : lastProgress;
    }

    public Optional<DiscoverySession> currentSession() {
        return Optional.ofNullable(state.getCurrentSession());
    }

    public DiscoveryActivity activity() {
        return state.snapshot();
    }

    public long getLastDiscoveryAt() {
        return state.getLastDiscoveryAt();
    }

    @Override
    public void close() {
        stop();
        cancel();
        executor.shutdownNow();
    }

    // Runs

    private CompletableFuture<DiscoveryOutcome> trigger(Collection<String> userIds, Set<DiscoveryTrigger> triggers) {
        if (!running.compareAndSet(false, true)) {
            logger.debug("Outbox discovery already running, ignoring {}", triggers);
            return CompletableFuture.completedFuture(DiscoveryOutcome.skipped(triggers, "Discovery already running"));
        }
        CancellationToken token = new CancellationToken();
        currentToken = token;
        List<String> users = new ArrayList<>(userIds);
        try {
            return CompletableFuture.supplyAsync(() -> runDiscovery(users, triggers, token), executor);
        } catch (RejectedExecutionException e) {
            currentToken = null;
            running.set(false);
            return CompletableFuture.completedFuture(DiscoveryOutcome.skipped(triggers, "Scheduler closed"));
        }
    }

    private DiscoveryOutcome runDiscovery(List<String> userIds, Set<DiscoveryTrigger> triggers,
                                          CancellationToken token) {
        try {
            boolean fullRefresh = false;
            for (DiscoveryTrigger trigger : triggers) {
                fullRefresh |= trigger.isFullRefresh();
            }
            if (fullRefresh) {
                state.clearDiscovered();
            }

            List<String> pending = state.filterUndiscovered(userIds);
            if (pending.isEmpty()) {
                logger.debug("No new users to discover");
                return DiscoveryOutcome.skipped(triggers, "No new users to discover");
            }
            if (config.getBootstrapRelays().isEmpty()) {
                logger.warn("No bootstrap relays configured, skipping outbox discovery");
                state.markInitialDiscoveryComplete();
                return DiscoveryOutcome.skipped(triggers, "No bootstrap relays");
            }
            return runBatches(pending, triggers, token);
        } finally {
            currentToken = null;
            running.set(false);
        }
    }

    private DiscoveryOutcome runBatches(List<String> users, Set<DiscoveryTrigger> triggers, CancellationToken token) {
        List<String> relays = config.getBootstrapRelays();
        DiscoverySession session = new DiscoverySession(users, config.getClock().millis());
        List<List<String>> batches = partition(users, config.getBatchSize());

        state.begin(session, relays);
        notifyStarted(session);
        logger.info("Outbox discovery {} started: {} users in {} batches on {} relays",
                session.getBatchId(), users.size(), batches.size(), relays.size());

        DiscoveryResult total = DiscoveryResult.success(0, 0);
        DiscoveryOutcome.Status status = DiscoveryOutcome.Status.COMPLETED;
        String reason = null;
        try {
            for (int i = 0; i < batches.size(); i++) {
                if (token.isCancelled()) {
                    status = DiscoveryOutcome.Status.CANCELLED;
                    break;
                }
                List<String> batch = batches.get(i);
                DiscoveryResult result = router.discoverBatch(batch, relays).get();
                total = total.plus(result);
                if (result.isSuccess()) {
                    state.markDiscovered(batch);
                } else {
                    logger.warn("Outbox discovery batch {}/{} failed: {}", i + 1, batches.size(), result.getError());
                }

                session.advance(batch.size());
                notifyProgress(session);

                if (i < batches.size() - 1 && token.sleep(config.getBatchDelayMs())) {
                    status = DiscoveryOutcome.Status.CANCELLED;
                    break;
                }
            }
            if (status == DiscoveryOutcome.Status.COMPLETED) {
                state.recordDiscovery(config.getClock().millis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = DiscoveryOutcome.Status.CANCELLED;
            reason = "Interrupted";
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            logger.error("Outbox discovery {} failed", session.getBatchId(), cause);
            status = DiscoveryOutcome.Status.FAILED;
            reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        } finally {
            lastProgress = session.getProgress();
            state.markInitialDiscoveryComplete();
            state.end();
        }

        if (status == DiscoveryOutcome.Status.CANCELLED) {
            logger.info("Outbox discovery {} cancelled at {}", session.getBatchId(), session.getProgress());
        } else if (status == DiscoveryOutcome.Status.COMPLETED) {
            logger.info("Outbox discovery {} complete: {}", session.getBatchId(), total);
        }
        DiscoveryOutcome outcome = DiscoveryOutcome.finished(status, triggers, users.size(), total, reason);
        notifyFinished(outcome);
        return outcome;
    }

    private boolean isRoutingTableEmpty() {
        try {
            return storage.getAllUsers().isEmpty();
        } catch (RuntimeException e) {
            logger.warn("Could not read routing table", e);
            return false;
        }
    }

    private void notifyStarted(DiscoverySession session) {
        for (DiscoveryListener listener : listeners) {
            try {
                listener.onDiscoveryStarted(session);
            } catch (Exception e) {
                logger.warn("Error in discovery listener", e);
            }
        }
    }

    private void notifyProgress(DiscoverySession session) {
        DiscoveryProgress progress = session.getProgress();
        for (DiscoveryListener listener : listeners) {
            try {
                listener.onProgress(session, progress);
            } catch (Exception e) {
                logger.warn("Error in discovery listener", e);
            }
        }
    }

    private void notifyFinished(DiscoveryOutcome outcome) {
        for (DiscoveryListener listener : listeners) {
            try {
                listener.onDiscoveryFinished(outcome);
            } catch (Exception e) {
                logger.warn("Error in discovery listener", e);
            }
        }
    }

    private static List<List<String>> partition(List<String> items, int size) {
        if (items.isEmpty()) {
            return Collections.emptyList();
        }
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            batches.add(new ArrayList<>(items.subList(start, Math.min(items.size(), start + size))));
        }
        return batches;
    }
}
