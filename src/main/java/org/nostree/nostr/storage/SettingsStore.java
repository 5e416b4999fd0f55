package org.nostree.nostr.storage;

/**
 * Small persisted key/value store for client state such as the last discovery time.
 */
public interface SettingsStore {

    /**
     * @return The stored value, or null
     */
    String get(String key);

    void set(String key, String value);

    void remove(String key);

    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    default long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    default void setLong(String key, long value) {
        set(key, Long.toString(value));
    }
}
