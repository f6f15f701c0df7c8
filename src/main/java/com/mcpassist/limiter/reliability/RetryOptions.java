package com.mcpassist.limiter.reliability;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Per-call settings of a {@link RetryExecutor} invocation. Kept apart from the executor so
 * that concurrent calls never share a listener or predicate.
 */
public final class RetryOptions {
    private static final RetryOptions DEFAULTS = newBuilder().build();

    private final String operationName;
    private final Predicate<Throwable> retryIf;
    private final RetryListener listener;

    private RetryOptions(Builder builder) {
        this.operationName = builder.operationName;
        this.retryIf = builder.retryIf;
        this.listener = builder.listener;
    }

    public static RetryOptions defaults() {
        return DEFAULTS;
    }

    public static RetryOptions named(String operationName) {
        return newBuilder().operationName(operationName).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public String getOperationName() { return operationName; }

    /**
     * Errors the predicate rejects are returned at once. Without one every error is retried.
     */
    public Predicate<Throwable> getRetryIf() { return retryIf; }

    public RetryListener getListener() { return listener; }

    public static class Builder {
        private String operationName = "unknown";
        private Predicate<Throwable> retryIf = error -> true;
        private RetryListener listener = (attempt, error, delay) -> { };

        public Builder operationName(String operationName) {
            this.operationName = Objects.requireNonNull(operationName, "operationName");
            return this;
        }

        public Builder retryIf(Predicate<Throwable> retryIf) {
            this.retryIf = Objects.requireNonNull(retryIf, "retryIf");
            return this;
        }

        public Builder onRetry(RetryListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        public RetryOptions build() {
            return new RetryOptions(this);
        }
    }
}
