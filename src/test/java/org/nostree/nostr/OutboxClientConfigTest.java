package org.nostree.nostr;

import org.junit.After;
import org.junit.Test;
import org.nostree.nostr.client.RelayConnectionPool;
import org.nostree.nostr.discovery.DiscoveryConfig;
import org.nostree.nostr.outbox.OutboxRouter;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Properties;

import static org.junit.Assert.*;

public class OutboxClientConfigTest {

    @After
    public void tearDown() {
        System.clearProperty("outbox.pool.maxConnections");
    }

    @Test
    public void testDefaults() {
        OutboxClientConfig config = OutboxClientConfig.fromProperties(new Properties());

        assertNull(config.getDbPath());
        assertEquals(RelayConnectionPool.DEFAULT_MAX_CONNECTIONS, config.getMaxConnections());
        assertEquals(OutboxRouter.DEFAULT_FALLBACK_RELAYS, config.getFallbackRelays());
        assertEquals(3, config.getBootstrapRelays().size());
        assertTrue(config.isVerifyEventIds());
        assertEquals(DiscoveryConfig.DEFAULT_MIN_INTERVAL_MS, config.getDiscoveryMinIntervalMs());
    }

    @Test
    public void testFromProperties() {
        Properties p = new Properties();
        p.setProperty("outbox.db.path", "/tmp/outbox/routes.db");
        p.setProperty("outbox.relays.bootstrap", " wss://a.example.com , ,wss://b.example.com");
        p.setProperty("outbox.pool.maxConnections", "7");
        p.setProperty("outbox.pool.queryTimeoutMs", "1500");
        p.setProperty("outbox.pool.verifyEventIds", "false");
        p.setProperty("outbox.router.maxRelaysPerUser", "2");
        p.setProperty("outbox.discovery.batchSize", "10");
        p.setProperty("outbox.discovery.refreshIntervalMs", "60000");

        OutboxClientConfig config = OutboxClientConfig.fromProperties(p);

        assertEquals(Paths.get("/tmp/outbox/routes.db"), config.getDbPath());
        assertEquals(Arrays.asList("wss://a.example.com", "wss://b.example.com"), config.getBootstrapRelays());
        assertEquals(7, config.getMaxConnections());
        assertEquals(1500L, config.getQueryTimeoutMs());
        assertFalse(config.isVerifyEventIds());
        assertEquals(2, config.getMaxRelaysPerUser());

        DiscoveryConfig discovery = config.toDiscoveryConfig();
        assertEquals(10, discovery.getBatchSize());
        assertEquals(60000L, discovery.getRefreshIntervalMs());
        assertEquals(config.getBootstrapRelays(), discovery.getBootstrapRelays());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidNumberIsRejected() {
        Properties p = new Properties();
        p.setProperty("outbox.pool.maxConnections", "many");
        OutboxClientConfig.fromProperties(p);
    }

    @Test
    public void testLoadAppliesSystemProperties() {
        assertEquals(20, OutboxClientConfig.load().getMaxConnections());

        System.setProperty("outbox.pool.maxConnections", "4");

        OutboxClientConfig config = OutboxClientConfig.load();
        assertEquals(4, config.getMaxConnections());
        assertEquals(25, config.getDiscoveryBatchSize());
    }
}
