package com.mcpassist.limiter.reliability;

/**
 * Why a {@link CallContext} ended.
 */
public enum CancellationReason {
    CANCELLED,
    DEADLINE_EXCEEDED,
    INTERRUPTED
}
