package com.mcpassist.limiter.reliability;

import java.time.Duration;

public final class NoBackoff implements BackoffStrategy {

    @Override
    public Duration nextDelay(int attempt) {
        return Duration.ZERO;
    }
}
