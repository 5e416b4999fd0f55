package org.nostree.nostr.discovery;

import org.nostree.nostr.client.RelayUrls;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Settings of the {@link DiscoveryScheduler}.
 */
public final class DiscoveryConfig {

    public static final int DEFAULT_BATCH_SIZE = 25;
    public static final long DEFAULT_BATCH_DELAY_MS = 500;
    public static final long DEFAULT_MIN_INTERVAL_MS = TimeUnit.MINUTES.toMillis(30);
    public static final long DEFAULT_REFRESH_INTERVAL_MS = TimeUnit.HOURS.toMillis(2);

    private final List<String> bootstrapRelays;
    private final int batchSize;
    private final long batchDelayMs;
    private final long minIntervalMs;
    private final long refreshIntervalMs;
    private final Clock clock;

    private DiscoveryConfig(Builder builder) {
        this.bootstrapRelays = Collections.unmodifiableList(RelayUrls.normalizeAll(builder.bootstrapRelays));
        this.batchSize = builder.batchSize;
        this.batchDelayMs = builder.batchDelayMs;
        this.minIntervalMs = builder.minIntervalMs;
        this.refreshIntervalMs = builder.refreshIntervalMs;
        this.clock = builder.clock;
    }

    // Getters
    public List<String> getBootstrapRelays() { return bootstrapRelays; }
    public int getBatchSize() { return batchSize; }
    public long getBatchDelayMs() { return batchDelayMs; }
    public long getMinIntervalMs() { return minIntervalMs; }
    public long getRefreshIntervalMs() { return refreshIntervalMs; }
    public Clock getClock() { return clock; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for DiscoveryConfig.
     */
    public static class Builder {
        private List<String> bootstrapRelays = new ArrayList<>();
        private int batchSize = DEFAULT_BATCH_SIZE;
        private long batchDelayMs = DEFAULT_BATCH_DELAY_MS;
        private long minIntervalMs = DEFAULT_MIN_INTERVAL_MS;
        private long refreshIntervalMs = DEFAULT_REFRESH_INTERVAL_MS;
        private Clock clock = Clock.systemUTC();

        /**
         * Relays queried for relay lists.
         */
        public Builder bootstrapRelays(List<String> relays) {
            this.bootstrapRelays = new ArrayList<>(relays);
            return this;
        }

        public Builder bootstrapRelays(String... relays) {
            return bootstrapRelays(Arrays.asList(relays));
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be at least 1");
            }
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Pause between two batches of a run.
         */
        public Builder batchDelayMs(long batchDelayMs) {
            this.batchDelayMs = batchDelayMs;
            return this;
        }

        /**
         * A check triggers a run once the last one is at least this old.
         */
        public Builder minIntervalMs(long minIntervalMs) {
            this.minIntervalMs = minIntervalMs;
            return this;
        }

        /**
         * Period of the background refresh, and age after which a check forces a full refresh.
         */
        public Builder refreshIntervalMs(long refreshIntervalMs) {
            this.refreshIntervalMs = refreshIntervalMs;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DiscoveryConfig build() {
            return new DiscoveryConfig(this);
        }
    }
}
