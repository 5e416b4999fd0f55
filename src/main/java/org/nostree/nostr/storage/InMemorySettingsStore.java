package org.nostree.nostr.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent {@link SettingsStore}.
 */
public class InMemorySettingsStore implements SettingsStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public String get(String key) {
        return values.get(key);
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }
}
