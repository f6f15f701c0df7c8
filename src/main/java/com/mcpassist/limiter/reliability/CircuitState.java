package com.mcpassist.limiter.reliability;

/**
 * States of a {@link CircuitBreaker}. The gauge value is what the state metric reports.
 */
public enum CircuitState {
    CLOSED("closed", 0),
    HALF_OPEN("half-open", 1),
    OPEN("open", 2);

    private final String id;
    private final int gaugeValue;

    CircuitState(String id, int gaugeValue) {
        this.id = id;
        this.gaugeValue = gaugeValue;
    }

    public String id() {
        return id;
    }

    public int gaugeValue() {
        return gaugeValue;
    }
}
