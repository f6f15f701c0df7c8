package com.mcpassist.limiter.reliability;

/**
 * Operation run by a {@link RetryExecutor}; {@code attempt} starts at 0.
 */
@FunctionalInterface
public interface RetryableOperation<T> {
    T call(int attempt) throws Exception;
}
