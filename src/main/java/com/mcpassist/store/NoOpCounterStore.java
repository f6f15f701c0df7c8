package com.mcpassist.store;

import java.time.Duration;

/**
 * Store that never counts, so every positive limit is always satisfied.
 */
public class NoOpCounterStore implements CounterStore {
    @Override public int increment(String key, Duration window) { return 1; }
    @Override public int get(String key) { return 0; }
    @Override public void reset(String key) {}
    @Override public void delete(String key) {}
}
