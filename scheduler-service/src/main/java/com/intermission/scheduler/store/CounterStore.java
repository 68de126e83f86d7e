package com.intermission.scheduler.store;

/**
 * Key-value store for small integer counters that must survive restarts.
 * Implementations degrade instead of throwing: a failed read yields the default,
 * a failed write is logged.
 */
public interface CounterStore {

    int load(String key, int defaultValue);

    void save(String key, int value);
}
