package com.mcpassist.store;

import java.time.Duration;

/**
 * Key to count storage backing the rate limiter.
 *
 * <p>Every implementation must apply fixed-window semantics in {@link #increment}:
 * a missing key starts at 1, a key whose window has elapsed restarts at 1 with a
 * fresh window start, any other key is incremented. The three cases form one
 * atomic step.</p>
 */
public interface CounterStore extends AutoCloseable {

    /**
     * Increments the counter for the key and returns the value AFTER increment.
     */
    int increment(String key, Duration window) throws CounterStoreException;

    /**
     * Current count for the key, 0 when absent or expired.
     */
    int get(String key) throws CounterStoreException;

    void reset(String key) throws CounterStoreException;

    void delete(String key) throws CounterStoreException;

    @Override
    default void close() {}
}
