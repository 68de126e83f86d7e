package com.intermission.scheduler.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local fallback used when no Redis connection is configured.
 */
public class InMemoryCounterStore implements CounterStore {

    private final Map<String, Integer> values = new ConcurrentHashMap<>();

    @Override
    public int load(String key, int defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    @Override
    public void save(String key, int value) {
        values.put(key, value);
    }
}
