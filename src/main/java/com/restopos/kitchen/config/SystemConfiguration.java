package com.restopos.kitchen.config;

import java.util.Map;
import java.util.Optional;

/**
 * Key/value system configuration shared with the rest of the point-of-sale backend.
 * <p>
 * Values can be changed externally at any time, so callers must not cache what they read. Implementations may throw
 * unchecked exceptions when the backing storage is unavailable; {@link ConfigReader} turns those into defaults.
 */
public interface SystemConfiguration {

    /**
     * Returns the raw value stored for the key, or empty if the key is absent.
     *
     * @param key
     * @return
     */
    Optional<String> get(String key);

    /**
     * Stores the value under the given key, replacing any previous value.
     *
     * @param key
     * @param value
     */
    void put(String key, String value);

    /**
     * Removes the key.
     *
     * @param key
     * @return true if the key was present.
     */
    boolean remove(String key);

    /**
     * Returns a point in time copy of all entries.
     *
     * @return
     */
    Map<String, String> entries();
}
