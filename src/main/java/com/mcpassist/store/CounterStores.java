package com.mcpassist.store;

import java.time.Clock;
import java.util.Objects;

/**
 * Creates the store backend named by a {@link StoreType}.
 */
public final class CounterStores {

    private CounterStores() {}

    public static CounterStore create(StoreType type) {
        return create(type, Clock.systemUTC());
    }

    public static CounterStore create(StoreType type, Clock clock) {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case MEMORY:
                return new InMemoryCounterStore(clock, InMemoryCounterStore.DEFAULT_EVICTION_INTERVAL,
                        InMemoryCounterStore.DEFAULT_IDLE_TTL);
            case NOOP:
                return new NoOpCounterStore();
            default:
                throw new IllegalArgumentException("unsupported store type: " + type);
        }
    }
}
