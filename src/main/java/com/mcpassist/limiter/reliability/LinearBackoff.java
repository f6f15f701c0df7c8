package com.mcpassist.limiter.reliability;

import java.time.Duration;
import java.util.Objects;

/**
 * {@code initialDelay * attempt}, capped at {@code maxDelay} when that is positive.
 * The delay after the first attempt (attempt 0) is therefore zero.
 */
public final class LinearBackoff implements BackoffStrategy {
    private final Duration initialDelay;
    private final Duration maxDelay;

    public LinearBackoff(Duration initialDelay, Duration maxDelay) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    }

    @Override
    public Duration nextDelay(int attempt) {
        Duration delay;
        try {
            delay = initialDelay.multipliedBy(Math.max(0, attempt));
        } catch (ArithmeticException e) {
            delay = maxDelay.isZero() ? Duration.ofNanos(Long.MAX_VALUE) : maxDelay;
        }
        if (!maxDelay.isZero() && delay.compareTo(maxDelay) > 0) {
            return maxDelay;
        }
        return delay;
    }
}
