package com.mcpassist.limiter.reliability;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

import com.mcpassist.limiter.metrics.MetricPublisher;
import com.mcpassist.limiter.metrics.NoOpMetricPublisher;
import com.mcpassist.limiter.metrics.ResilienceMetric;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Three-state circuit breaker guarding one logical operation.
 *
 * <p>CLOSED counts consecutive failures and opens at {@code maxFailures}. OPEN rejects
 * every call until {@code openTimeout} has elapsed since the last failure; the first call
 * after that moves the breaker to HALF_OPEN. HALF_OPEN admits at most
 * {@code maxHalfOpenTrials} concurrent or successful trials, closes after that many
 * successes and reopens on the first failure.</p>
 *
 * <p>All state lives behind one lock. The timeout transition and the admission decision
 * are taken in the same critical section. Metrics and logs for a transition are emitted
 * after the lock is released.</p>
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int maxFailures;
    private final Duration openTimeout;
    private final int maxHalfOpenTrials;
    private final Clock clock;
    private final MetricPublisher metricPublisher;
    private final Map<String, String> nameLabel;

    private final ReentrantLock lock = new ReentrantLock();
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int halfOpenSuccessCount;
    private int trialsInFlight;
    private Instant lastFailureAt;

    public CircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), NoOpMetricPublisher.INSTANCE);
    }

    public CircuitBreaker(CircuitBreakerConfig config, Clock clock, MetricPublisher metricPublisher) {
        Objects.requireNonNull(config, "config");
        this.name = config.getName();
        this.maxFailures = config.getMaxFailures();
        this.openTimeout = config.getOpenTimeout();
        this.maxHalfOpenTrials = config.getMaxHalfOpenTrials();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricPublisher = metricPublisher == null ? NoOpMetricPublisher.INSTANCE : metricPublisher;
        this.nameLabel = Map.of("name", name);
        publishState(CircuitState.CLOSED);
    }

    /**
     * Runs the operation if the breaker admits it and records the outcome.
     *
     * @throws CircuitBreakerOpenException if the call was rejected; the operation did not run
     * @throws Exception whatever the operation threw, unchanged
     */
    public <T> T call(Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        CircuitState rejectedIn = acquire();
        if (rejectedIn != null) {
            throw new CircuitBreakerOpenException(name, rejectedIn);
        }
        T result;
        try {
            result = operation.call();
        } catch (Throwable t) {
            recordFailure(t);
            throw t;
        }
        recordSuccess();
        return result;
    }

    /**
     * Decides admission for one call, moving OPEN to HALF_OPEN first when the open timeout
     * has elapsed. An admitted half-open call holds a trial slot until its outcome is recorded.
     */
    public boolean tryAcquirePermission() {
        return acquire() == null;
    }

    // null when admitted, otherwise the state that rejected the call
    private CircuitState acquire() {
        Transition transition = null;
        boolean permitted;
        CircuitState observed;
        lock.lock();
        try {
            if (state == CircuitState.OPEN && openTimeoutElapsed()) {
                transition = transitionTo(CircuitState.HALF_OPEN);
            }
            switch (state) {
                case CLOSED:
                    permitted = true;
                    break;
                case HALF_OPEN:
                    permitted = halfOpenSuccessCount + trialsInFlight < maxHalfOpenTrials;
                    if (permitted) {
                        trialsInFlight++;
                    }
                    break;
                default:
                    permitted = false;
            }
            observed = state;
        } finally {
            lock.unlock();
        }

        publish(transition);
        if (permitted) {
            metricPublisher.incrementCounter(ResilienceMetric.CIRCUIT_BREAKER_REQUESTS_ALLOWED.metricName(), 1, nameLabel);
        } else {
            metricPublisher.incrementCounter(ResilienceMetric.CIRCUIT_BREAKER_REQUESTS_REJECTED.metricName(), 1, nameLabel);
            logger.debug("Circuit breaker {} rejected request in state {}", name, observed.id());
        }
        return permitted ? null : observed;
    }

    public void recordSuccess() {
        Transition transition = null;
        lock.lock();
        try {
            releaseTrial();
            switch (state) {
                case CLOSED:
                    failureCount = 0;
                    break;
                case HALF_OPEN:
                    halfOpenSuccessCount++;
                    if (halfOpenSuccessCount >= maxHalfOpenTrials) {
                        transition = transitionTo(CircuitState.CLOSED);
                    }
                    break;
                case OPEN:
                    // only reachable when outcomes are recorded without a permission
                    transition = transitionTo(CircuitState.CLOSED);
                    break;
                default:
                    break;
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    public void recordFailure(Throwable error) {
        Transition transition = null;
        lock.lock();
        try {
            releaseTrial();
            lastFailureAt = clock.instant();
            switch (state) {
                case CLOSED:
                    failureCount++;
                    if (failureCount >= maxFailures) {
                        transition = transitionTo(CircuitState.OPEN);
                    }
                    break;
                case HALF_OPEN:
                    transition = transitionTo(CircuitState.OPEN);
                    break;
                default:
                    break;
            }
        } finally {
            lock.unlock();
        }
        if (error != null) {
            logger.debug("Circuit breaker {} recorded failure: {}", name, error.toString());
        }
        publish(transition);
    }

    /**
     * Forces the breaker back to CLOSED and forgets the last failure.
     */
    public void reset() {
        Transition transition;
        lock.lock();
        try {
            transition = transitionTo(CircuitState.CLOSED);
            failureCount = 0;
            halfOpenSuccessCount = 0;
            trialsInFlight = 0;
            lastFailureAt = null;
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    /**
     * Current state as last decided. An OPEN breaker whose timeout has elapsed still reports
     * OPEN until the next call.
     */
    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() { return getState() == CircuitState.CLOSED; }
    public boolean isOpen() { return getState() == CircuitState.OPEN; }
    public boolean isHalfOpen() { return getState() == CircuitState.HALF_OPEN; }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "CircuitBreaker{name=" + name + ", state=" + state.id() + ", failures=" + failureCount
                    + ", lastFailure=" + lastFailureAt + "}";
        } finally {
            lock.unlock();
        }
    }

    // Callers hold the lock.
    private boolean openTimeoutElapsed() {
        return lastFailureAt == null || !clock.instant().isBefore(lastFailureAt.plus(openTimeout));
    }

    private void releaseTrial() {
        if (trialsInFlight > 0) {
            trialsInFlight--;
        }
    }

    private Transition transitionTo(CircuitState next) {
        if (state == next) {
            return null;
        }
        CircuitState previous = state;
        state = next;
        failureCount = 0;
        halfOpenSuccessCount = 0;
        trialsInFlight = 0;
        return new Transition(previous, next);
    }

    private void publish(Transition transition) {
        if (transition == null) {
            return;
        }
        if (transition.to == CircuitState.OPEN) {
            logger.warn("Circuit breaker {} opened (from {}), rejecting calls for {}",
                    name, transition.from.id(), openTimeout);
        } else {
            logger.info("Circuit breaker {} transitioned from {} to {}", name, transition.from.id(), transition.to.id());
        }
        metricPublisher.incrementCounter(ResilienceMetric.CIRCUIT_BREAKER_TRANSITIONS.metricName(), 1,
                Map.of("name", name, "from_state", transition.from.id(), "to_state", transition.to.id()));
        publishState(transition.to);
    }

    private void publishState(CircuitState current) {
        metricPublisher.gauge(ResilienceMetric.CIRCUIT_BREAKER_STATE.metricName(), current.gaugeValue(), nameLabel);
    }

    private static final class Transition {
        final CircuitState from;
        final CircuitState to;

        Transition(CircuitState from, CircuitState to) {
            this.from = from;
            this.to = to;
        }
    }
}
