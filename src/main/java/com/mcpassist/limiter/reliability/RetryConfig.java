package com.mcpassist.limiter.reliability;

import java.time.Duration;
import java.util.Map;

import com.mcpassist.config.EnvSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable retry settings shared by every call of a {@link RetryExecutor}.
 */
public final class RetryConfig {
    private static final Logger logger = LoggerFactory.getLogger(RetryConfig.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final boolean jitter;
    private final BackoffType strategy;

    private RetryConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.jitter = builder.jitter;
        this.strategy = builder.strategy;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static RetryConfig defaults() {
        return newBuilder().build();
    }

    /**
     * Defaults overridden by {@code MCP_RETRY_*} variables. Values that do not parse are
     * ignored; the combined result is still validated.
     *
     * @throws IllegalArgumentException if the overrides produce an invalid configuration
     */
    public static RetryConfig fromEnvironment(Map<String, String> env) {
        EnvSettings settings = EnvSettings.of(env);
        Builder builder = newBuilder();
        settings.positiveInt("MCP_RETRY_MAX_ATTEMPTS").ifPresent(builder::maxAttempts);
        settings.duration("MCP_RETRY_INITIAL_DELAY").ifPresent(builder::initialDelay);
        settings.duration("MCP_RETRY_MAX_DELAY").ifPresent(builder::maxDelay);
        settings.decimal("MCP_RETRY_MULTIPLIER").ifPresent(builder::multiplier);
        settings.bool("MCP_RETRY_JITTER").ifPresent(builder::jitter);
        settings.string("MCP_RETRY_STRATEGY").ifPresent(name -> {
            try {
                builder.strategy(BackoffType.fromName(name));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring MCP_RETRY_STRATEGY: {}", e.getMessage());
            }
        });
        return builder.build();
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getInitialDelay() { return initialDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getMultiplier() { return multiplier; }
    public boolean isJitter() { return jitter; }
    public BackoffType getStrategy() { return strategy; }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .multiplier(multiplier)
                .jitter(jitter)
                .strategy(strategy);
    }

    @Override
    public String toString() {
        return "RetryConfig{maxAttempts=" + maxAttempts + ", initialDelay=" + initialDelay + ", maxDelay=" + maxDelay
                + ", multiplier=" + multiplier + ", jitter=" + jitter + ", strategy=" + strategy.id() + "}";
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private boolean jitter = true;
        private BackoffType strategy = BackoffType.EXPONENTIAL;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder strategy(BackoffType strategy) {
            this.strategy = strategy;
            return this;
        }

        /**
         * Strategy by name; an empty name selects exponential.
         */
        public Builder strategy(String name) {
            this.strategy = BackoffType.fromName(name);
            return this;
        }

        public RetryConfig build() {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("max attempts must be at least 1: " + maxAttempts);
            }
            if (initialDelay == null || initialDelay.isNegative()) {
                throw new IllegalArgumentException("initial delay cannot be negative: " + initialDelay);
            }
            if (maxDelay == null || maxDelay.isNegative()) {
                throw new IllegalArgumentException("max delay cannot be negative: " + maxDelay);
            }
            if (!maxDelay.isZero() && initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException(
                        "initial delay cannot be greater than max delay: " + initialDelay + " > " + maxDelay);
            }
            if (!(multiplier > 0)) {
                throw new IllegalArgumentException("multiplier must be positive: " + multiplier);
            }
            if (strategy == null) {
                strategy = BackoffType.EXPONENTIAL;
            }
            return new RetryConfig(this);
        }
    }
}
