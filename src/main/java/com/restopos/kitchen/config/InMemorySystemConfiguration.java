package com.restopos.kitchen.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Singleton;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process local {@link SystemConfiguration}. Every read goes to the map, so a change made by another thread is visible
 * to the very next read.
 */
@ThreadSafe @Singleton public class InMemorySystemConfiguration implements SystemConfiguration {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override public void put(String key, String value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        values.put(key, value);
    }

    @Override public boolean remove(String key) {
        return values.remove(key) != null;
    }

    @Override public Map<String, String> entries() {
        return ImmutableMap.copyOf(values);
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(InMemorySystemConfiguration.class).add("values", values).toString();
    }
}
