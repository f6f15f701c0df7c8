package com.mcpassist.store;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window counter for one key. Mutable; guarded by the owning store's lock.
 */
final class Bucket {
    private int count;
    private Instant windowStart;
    private Instant lastUpdate;
    private Duration window;

    Bucket(Instant now, Duration window) {
        this.count = 1;
        this.windowStart = now;
        this.lastUpdate = now;
        this.window = window;
    }

    boolean isExpired(Instant now) {
        return Duration.between(windowStart, now).compareTo(window) >= 0;
    }

    int increment(Instant now, Duration window) {
        this.window = window;
        if (isExpired(now)) {
            count = 1;
            windowStart = now;
        } else {
            count++;
        }
        lastUpdate = now;
        return count;
    }

    int getCount() { return count; }

    Instant getLastUpdate() { return lastUpdate; }
}
