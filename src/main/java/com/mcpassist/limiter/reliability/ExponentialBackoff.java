package com.mcpassist.limiter.reliability;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@code initialDelay * multiplier^attempt}, capped at {@code maxDelay} when that is
 * positive. With jitter the capped value moves by a uniform offset within ±25%, never
 * below zero.
 */
public final class ExponentialBackoff implements BackoffStrategy {
    private static final double JITTER_FRACTION = 0.25;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final boolean jitter;
    private final DoubleSupplier random;

    public ExponentialBackoff(Duration initialDelay, Duration maxDelay, double multiplier, boolean jitter) {
        this(initialDelay, maxDelay, multiplier, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoff(Duration initialDelay, Duration maxDelay, double multiplier, boolean jitter,
            DoubleSupplier random) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    public Duration nextDelay(int attempt) {
        double nanos = initialDelay.toNanos() * Math.pow(multiplier, Math.max(0, attempt));
        if (!maxDelay.isZero()) {
            nanos = Math.min(nanos, maxDelay.toNanos());
        }
        // an uncapped pow can reach Infinity; jitter on Infinity yields NaN
        nanos = Math.min(nanos, (double) Long.MAX_VALUE);
        if (jitter) {
            double offset = (random.getAsDouble() - 0.5) * 2 * JITTER_FRACTION * nanos;
            nanos = Math.max(0, nanos + offset);
        }
        if (nanos >= Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos((long) nanos);
    }
}
