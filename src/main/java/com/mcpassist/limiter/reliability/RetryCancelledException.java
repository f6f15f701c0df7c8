package com.mcpassist.limiter.reliability;

import java.util.Locale;

import com.mcpassist.limiter.ResilienceException;

/**
 * The call context ended before or between attempts. Never retried.
 */
public class RetryCancelledException extends ResilienceException {
    private final CancellationReason reason;
    private final int attempts;

    public RetryCancelledException(CancellationReason reason, int attempts, Throwable lastError) {
        super("context cancelled: " + reason.name().toLowerCase(Locale.ROOT).replace('_', ' ') + " after " + attempts
                + " attempts", lastError);
        this.reason = reason;
        this.attempts = attempts;
    }

    public CancellationReason getReason() { return reason; }

    /**
     * Number of attempts that actually ran.
     */
    public int getAttempts() { return attempts; }
}
