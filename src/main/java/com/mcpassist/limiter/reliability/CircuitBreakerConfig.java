package com.mcpassist.limiter.reliability;

import java.time.Duration;

/**
 * Immutable circuit breaker settings.
 */
public final class CircuitBreakerConfig {
    public static final int DEFAULT_MAX_FAILURES = 5;
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_HALF_OPEN_TRIALS = 3;

    private final String name;
    private final int maxFailures;
    private final Duration openTimeout;
    private final int maxHalfOpenTrials;

    private CircuitBreakerConfig(Builder builder) {
        this.name = builder.name;
        this.maxFailures = builder.maxFailures;
        this.openTimeout = builder.openTimeout;
        this.maxHalfOpenTrials = builder.maxHalfOpenTrials;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static CircuitBreakerConfig defaults(String name) {
        return builder(name).build();
    }

    public String getName() { return name; }
    public int getMaxFailures() { return maxFailures; }
    public Duration getOpenTimeout() { return openTimeout; }
    public int getMaxHalfOpenTrials() { return maxHalfOpenTrials; }

    public Builder toBuilder() {
        return new Builder(name)
                .maxFailures(maxFailures)
                .openTimeout(openTimeout)
                .maxHalfOpenTrials(maxHalfOpenTrials);
    }

    @Override
    public String toString() {
        return "CircuitBreakerConfig{name='" + name + "', maxFailures=" + maxFailures
                + ", openTimeout=" + openTimeout + ", maxHalfOpenTrials=" + maxHalfOpenTrials + "}";
    }

    public static class Builder {
        private String name;
        private int maxFailures = DEFAULT_MAX_FAILURES;
        private Duration openTimeout = DEFAULT_OPEN_TIMEOUT;
        private int maxHalfOpenTrials = DEFAULT_MAX_HALF_OPEN_TRIALS;

        private Builder(String name) {
            this.name = name;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder maxFailures(int maxFailures) {
            this.maxFailures = maxFailures;
            return this;
        }

        public Builder openTimeout(Duration openTimeout) {
            this.openTimeout = openTimeout;
            return this;
        }

        public Builder maxHalfOpenTrials(int maxHalfOpenTrials) {
            this.maxHalfOpenTrials = maxHalfOpenTrials;
            return this;
        }

        /**
         * @throws IllegalArgumentException on an empty name or non-positive settings
         */
        public CircuitBreakerConfig build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("circuit breaker name cannot be empty");
            }
            if (maxFailures <= 0) {
                throw new IllegalArgumentException("max failures must be positive: " + maxFailures);
            }
            if (openTimeout == null || openTimeout.isZero() || openTimeout.isNegative()) {
                throw new IllegalArgumentException("open timeout must be positive: " + openTimeout);
            }
            if (maxHalfOpenTrials <= 0) {
                throw new IllegalArgumentException("max half-open trials must be positive: " + maxHalfOpenTrials);
            }
            return new CircuitBreakerConfig(this);
        }
    }
}
