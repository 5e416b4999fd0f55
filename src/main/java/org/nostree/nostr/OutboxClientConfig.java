package org.nostree.nostr;

import org.nostree.nostr.client.RelayConnectionPool;
import org.nostree.nostr.discovery.DiscoveryConfig;
import org.nostree.nostr.outbox.OutboxRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Settings of an {@link OutboxClient}. Build one with {@link #builder()} or read
 * {@value #RESOURCE_NAME} from the classpath with {@link #load()}.
 */
public final class OutboxClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(OutboxClientConfig.class);

    public static final String RESOURCE_NAME = "nostree-outbox.properties";

    private final Path dbPath;
    private final List<String> bootstrapRelays;
    private final List<String> fallbackRelays;
    private final int maxConnections;
    private final long connectTimeoutMs;
    private final long connectionWaitMs;
    private final long queryTimeoutMs;
    private final long publishTimeoutMs;
    private final long idleTimeoutMs;
    private final int maxReconnectAttempts;
    private final boolean verifyEventIds;
    private final int maxRelaysPerUser;
    private final int discoveryBatchSize;
    private final long discoveryBatchDelayMs;
    private final long discoveryMinIntervalMs;
    private final long discoveryRefreshIntervalMs;

    private OutboxClientConfig(Builder b) {
        this.dbPath = b.dbPath;
        this.bootstrapRelays = new ArrayList<>(b.bootstrapRelays);
        this.fallbackRelays = new ArrayList<>(b.fallbackRelays);
        this.maxConnections = b.maxConnections;
        this.connectTimeoutMs = b.connectTimeoutMs;
        this.connectionWaitMs = b.connectionWaitMs;
        this.queryTimeoutMs = b.queryTimeoutMs;
        this.publishTimeoutMs = b.publishTimeoutMs;
        this.idleTimeoutMs = b.idleTimeoutMs;
        this.maxReconnectAttempts = b.maxReconnectAttempts;
        this.verifyEventIds = b.verifyEventIds;
        this.maxRelaysPerUser = b.maxRelaysPerUser;
        this.discoveryBatchSize = b.discoveryBatchSize;
        this.discoveryBatchDelayMs = b.discoveryBatchDelayMs;
        this.discoveryMinIntervalMs = b.discoveryMinIntervalMs;
        this.discoveryRefreshIntervalMs = b.discoveryRefreshIntervalMs;
    }

    /**
     * Read {@value #RESOURCE_NAME} from the classpath, then apply system properties
     * with the same keys on top.
     */
    public static OutboxClientConfig load() {
        Properties properties = new Properties();
        try (InputStream in = OutboxClientConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.info("{} not found on classpath, using defaults", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("outbox.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Build a config from {@code outbox.*} properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a numeric value does not parse
     */
    public static OutboxClientConfig fromProperties(Properties p) {
        Builder b = builder();
        String db = p.getProperty("outbox.db.path", "").trim();
        if (!db.isEmpty()) {
            b.dbPath(Paths.get(db));
        }
        if (p.getProperty("outbox.relays.bootstrap") != null) {
            b.bootstrapRelays(splitList(p.getProperty("outbox.relays.bootstrap")));
        }
        if (p.getProperty("outbox.relays.fallback") != null) {
            b.fallbackRelays(splitList(p.getProperty("outbox.relays.fallback")));
        }
        b.maxConnections(intProperty(p, "outbox.pool.maxConnections", b.maxConnections));
        b.connectTimeoutMs(longProperty(p, "outbox.pool.connectTimeoutMs", b.connectTimeoutMs));
        b.connectionWaitMs(longProperty(p, "outbox.pool.connectionWaitMs", b.connectionWaitMs));
        b.queryTimeoutMs(longProperty(p, "outbox.pool.queryTimeoutMs", b.queryTimeoutMs));
        b.publishTimeoutMs(longProperty(p, "outbox.pool.publishTimeoutMs", b.publishTimeoutMs));
        b.idleTimeoutMs(longProperty(p, "outbox.pool.idleTimeoutMs", b.idleTimeoutMs));
        b.maxReconnectAttempts(intProperty(p, "outbox.pool.maxReconnectAttempts", b.maxReconnectAttempts));
        b.verifyEventIds(Boolean.parseBoolean(
                p.getProperty("outbox.pool.verifyEventIds", Boolean.toString(b.verifyEventIds)).trim()));
        b.maxRelaysPerUser(intProperty(p, "outbox.router.maxRelaysPerUser", b.maxRelaysPerUser));
        b.discoveryBatchSize(intProperty(p, "outbox.discovery.batchSize", b.discoveryBatchSize));
        b.discoveryBatchDelayMs(longProperty(p, "outbox.discovery.batchDelayMs", b.discoveryBatchDelayMs));
        b.discoveryMinIntervalMs(longProperty(p, "outbox.discovery.minIntervalMs", b.discoveryMinIntervalMs));
        b.discoveryRefreshIntervalMs(longProperty(p, "outbox.discovery.refreshIntervalMs", b.discoveryRefreshIntervalMs));
        return b.build();
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.trim().isEmpty()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private static int intProperty(Properties p, String key, int defaultValue) {
        String value = p.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long longProperty(Properties p, String key, long defaultValue) {
        String value = p.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    /**
     * Discovery settings derived from this config.
     */
    public DiscoveryConfig toDiscoveryConfig() {
        return DiscoveryConfig.builder()
            .bootstrapRelays(bootstrapRelays)
            .batchSize(discoveryBatchSize)
            .batchDelayMs(discoveryBatchDelayMs)
            .minIntervalMs(discoveryMinIntervalMs)
            .refreshIntervalMs(discoveryRefreshIntervalMs)
            .build();
    }

    // Getters

    /**
     * SQLite file of the routing table; null keeps routes in memory.
     */
    public Path getDbPath() { return dbPath; }
    public List<String> getBootstrapRelays() { return new ArrayList<>(bootstrapRelays); }
    public List<String> getFallbackRelays() { return new ArrayList<>(fallbackRelays); }
    public int getMaxConnections() { return maxConnections; }
    public long getConnectTimeoutMs() { return connectTimeoutMs; }
    public long getConnectionWaitMs() { return connectionWaitMs; }
    public long getQueryTimeoutMs() { return queryTimeoutMs; }
    public long getPublishTimeoutMs() { return publishTimeoutMs; }
    public long getIdleTimeoutMs() { return idleTimeoutMs; }
    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public boolean isVerifyEventIds() { return verifyEventIds; }
    public int getMaxRelaysPerUser() { return maxRelaysPerUser; }
    public int getDiscoveryBatchSize() { return discoveryBatchSize; }
    public long getDiscoveryBatchDelayMs() { return discoveryBatchDelayMs; }
    public long getDiscoveryMinIntervalMs() { return discoveryMinIntervalMs; }
    public long getDiscoveryRefreshIntervalMs() { return discoveryRefreshIntervalMs; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for OutboxClientConfig.
     */
    public static class Builder {
        private Path dbPath;
        private List<String> bootstrapRelays = Arrays.asList("wss://purplepag.es", "wss://relay.damus.io", "wss://nos.lol");
        private List<String> fallbackRelays = OutboxRouter.DEFAULT_FALLBACK_RELAYS;
        private int maxConnections = RelayConnectionPool.DEFAULT_MAX_CONNECTIONS;
        private long connectTimeoutMs = RelayConnectionPool.DEFAULT_CONNECT_TIMEOUT_MS;
        private long connectionWaitMs = RelayConnectionPool.DEFAULT_CONNECTION_WAIT_MS;
        private long queryTimeoutMs = RelayConnectionPool.DEFAULT_QUERY_TIMEOUT_MS;
        private long publishTimeoutMs = RelayConnectionPool.DEFAULT_PUBLISH_TIMEOUT_MS;
        private long idleTimeoutMs = RelayConnectionPool.DEFAULT_IDLE_TIMEOUT_MS;
        private int maxReconnectAttempts = RelayConnectionPool.DEFAULT_MAX_RECONNECT_ATTEMPTS;
        private boolean verifyEventIds = true;
        private int maxRelaysPerUser = OutboxRouter.DEFAULT_MAX_RELAYS_PER_USER;
        private int discoveryBatchSize = DiscoveryConfig.DEFAULT_BATCH_SIZE;
        private long discoveryBatchDelayMs = DiscoveryConfig.DEFAULT_BATCH_DELAY_MS;
        private long discoveryMinIntervalMs = DiscoveryConfig.DEFAULT_MIN_INTERVAL_MS;
        private long discoveryRefreshIntervalMs = DiscoveryConfig.DEFAULT_REFRESH_INTERVAL_MS;

        public Builder dbPath(Path dbPath) {
            this.dbPath = dbPath;
            return this;
        }

        public Builder bootstrapRelays(List<String> relays) {
            this.bootstrapRelays = new ArrayList<>(relays);
            return this;
        }

        public Builder fallbackRelays(List<String> relays) {
            this.fallbackRelays = new ArrayList<>(relays);
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder connectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder connectionWaitMs(long connectionWaitMs) {
            this.connectionWaitMs = connectionWaitMs;
            return this;
        }

        public Builder queryTimeoutMs(long queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
            return this;
        }

        public Builder publishTimeoutMs(long publishTimeoutMs) {
            this.publishTimeoutMs = publishTimeoutMs;
            return this;
        }

        public Builder idleTimeoutMs(long idleTimeoutMs) {
            this.idleTimeoutMs = idleTimeoutMs;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder verifyEventIds(boolean verifyEventIds) {
            this.verifyEventIds = verifyEventIds;
            return this;
        }

        public Builder maxRelaysPerUser(int maxRelaysPerUser) {
            this.maxRelaysPerUser = maxRelaysPerUser;
            return this;
        }

        public Builder discoveryBatchSize(int discoveryBatchSize) {
            this.discoveryBatchSize = discoveryBatchSize;
            return this;
        }

        public Builder discoveryBatchDelayMs(long discoveryBatchDelayMs) {
            this.discoveryBatchDelayMs = discoveryBatchDelayMs;
            return this;
        }

        public Builder discoveryMinIntervalMs(long discoveryMinIntervalMs) {
            this.discoveryMinIntervalMs = discoveryMinIntervalMs;
            return this;
        }

        public Builder discoveryRefreshIntervalMs(long discoveryRefreshIntervalMs) {
            this.discoveryRefreshIntervalMs = discoveryRefreshIntervalMs;
            return this;
        }

        public OutboxClientConfig build() {
            return new OutboxClientConfig(this);
        }
    }
}
