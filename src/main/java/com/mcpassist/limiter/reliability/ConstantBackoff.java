package com.mcpassist.limiter.reliability;

import java.time.Duration;
import java.util.Objects;

public final class ConstantBackoff implements BackoffStrategy {
    private final Duration delay;

    public ConstantBackoff(Duration delay) {
        this.delay = Objects.requireNonNull(delay, "delay");
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delay;
    }
}
