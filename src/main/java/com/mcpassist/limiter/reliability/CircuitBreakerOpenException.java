package com.mcpassist.limiter.reliability;

import com.mcpassist.limiter.ResilienceException;

/**
 * A call was rejected without running because the breaker is open or its half-open
 * trials are taken.
 */
public class CircuitBreakerOpenException extends ResilienceException {
    private final String name;
    private final CircuitState state;

    public CircuitBreakerOpenException(String name, CircuitState state) {
        super("circuit breaker '" + name + "': request rejected: circuit breaker is " + state.id());
        this.name = name;
        this.state = state;
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return state;
    }
}
