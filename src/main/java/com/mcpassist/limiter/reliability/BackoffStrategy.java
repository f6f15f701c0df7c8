package com.mcpassist.limiter.reliability;

import java.time.Duration;

/**
 * Delay to wait after a failed attempt. Attempts are zero-indexed. Implementations are
 * stateless and safe to share.
 */
@FunctionalInterface
public interface BackoffStrategy {

    Duration nextDelay(int attempt);

    static BackoffStrategy of(RetryConfig config) {
        switch (config.getStrategy()) {
            case NONE:
                return new NoBackoff();
            case CONSTANT:
                return new ConstantBackoff(config.getInitialDelay());
            case LINEAR:
                return new LinearBackoff(config.getInitialDelay(), config.getMaxDelay());
            case EXPONENTIAL:
                return new ExponentialBackoff(config.getInitialDelay(), config.getMaxDelay(),
                        config.getMultiplier(), config.isJitter());
            default:
                throw new IllegalArgumentException("unknown backoff strategy: " + config.getStrategy());
        }
    }
}
