package com.mcpassist.limiter.reliability;

import java.time.Duration;

import com.mcpassist.limiter.ResilienceException;

/**
 * Every attempt failed. The last failure is the cause.
 */
public class RetryExhaustedException extends ResilienceException {
    private final int attempts;
    private final Duration lastDelay;
    private final Duration totalDelay;

    public RetryExhaustedException(Throwable cause, int attempts, Duration lastDelay, Duration totalDelay) {
        super("max retry attempts exceeded: failed after " + attempts + " attempts: " + cause, cause);
        this.attempts = attempts;
        this.lastDelay = lastDelay;
        this.totalDelay = totalDelay;
    }

    public int getAttempts() { return attempts; }
    public Duration getLastDelay() { return lastDelay; }
    public Duration getTotalDelay() { return totalDelay; }
}
