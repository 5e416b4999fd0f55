package org.nostree.nostr.storage;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class InMemoryRoutingStorageTest extends RoutingStorageTestBase {

    private InMemoryRoutingStorage storage;

    @Before
    public void setUp() {
        storage = new InMemoryRoutingStorage();
    }

    @Override
    protected RoutingStorage storage() {
        return storage;
    }

    @Test
    public void testSettingsDefaults() {
        InMemorySettingsStore settings = new InMemorySettingsStore();

        assertNull(settings.get("missing"));
        assertEquals("fallback", settings.get("missing", "fallback"));
        assertEquals(7L, settings.getLong("missing", 7L));

        settings.set("broken", "not a number");
        assertEquals(7L, settings.getLong("broken", 7L));

        settings.setLong("count", 42L);
        assertEquals(42L, settings.getLong("count", 0L));
        settings.remove("count");
        assertNull(settings.get("count"));
    }
}
