package com.mcpassist.limiter.reliability;

import java.time.Duration;

/**
 * Notified before the executor waits for the next attempt.
 */
@FunctionalInterface
public interface RetryListener {
    void onRetry(int attempt, Throwable error, Duration delay);
}
